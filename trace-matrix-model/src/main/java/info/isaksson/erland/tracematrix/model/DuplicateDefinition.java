package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** An identifier defined more than once. The first path is the canonical definition. */
@JsonPropertyOrder({"id", "extraDefinitions", "paths"})
public final class DuplicateDefinition {
    public final String id;
    /** Number of definitions beyond the canonical one (N definitions: N - 1). */
    public final int extraDefinitions;
    public final List<String> paths;

    public DuplicateDefinition(String id, int extraDefinitions, List<String> paths) {
        this.id = Objects.requireNonNull(id, "id");
        this.extraDefinitions = extraDefinitions;
        this.paths = paths == null ? List.of() : List.copyOf(paths);
    }

    @Override
    public String toString() {
        return id + " (extra definitions: " + extraDefinitions + ")";
    }
}
