package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * One appearance of an identifier in a document.
 *
 * <p>Only definitions carry a title, priority and acceptance criteria. Line numbers are 1-based;
 * a front matter definition uses line 0.</p>
 */
@JsonPropertyOrder({"id", "kind", "path", "line", "title", "priority", "acceptanceCriteria"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Occurrence {
    public enum Kind { DEFINITION, REFERENCE }

    public final Identifier id;
    public final Kind kind;
    public final String path;
    public final int line;
    public final String title;
    /** Declared priority ({@code P0}..{@code Pn}), or null when the document does not state one. */
    public final String priority;
    public final List<String> acceptanceCriteria;

    private Occurrence(Identifier id, Kind kind, String path, int line, String title, String priority, List<String> acceptanceCriteria) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = Objects.requireNonNull(path, "path");
        this.line = line;
        this.title = title;
        this.priority = priority;
        this.acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
    }

    public static Occurrence definition(Identifier id, String path, int line, String title, String priority, List<String> acceptanceCriteria) {
        return new Occurrence(id, Kind.DEFINITION, path, line, title, priority, acceptanceCriteria);
    }

    public static Occurrence reference(Identifier id, String path, int line) {
        return new Occurrence(id, Kind.REFERENCE, path, line, null, null, null);
    }

    @JsonIgnore
    public boolean isDefinition() {
        return kind == Kind.DEFINITION;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + id + " @ " + path + ":" + line;
    }
}
