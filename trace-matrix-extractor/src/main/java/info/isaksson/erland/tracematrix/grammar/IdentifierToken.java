package info.isaksson.erland.tracematrix.grammar;

import info.isaksson.erland.tracematrix.model.Identifier;
import info.isaksson.erland.tracematrix.model.Occurrence;

import java.util.Objects;

/** An identifier found in a line, with its column span and classified kind. */
public final class IdentifierToken {
    public final Identifier id;
    public final Occurrence.Kind kind;
    /** Start column (inclusive, 0-based). */
    public final int start;
    /** End column (exclusive). */
    public final int end;

    public IdentifierToken(Identifier id, Occurrence.Kind kind, int start, int end) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.start = start;
        this.end = end;
    }

    public boolean isDefinition() {
        return kind == Occurrence.Kind.DEFINITION;
    }

    @Override
    public String toString() {
        return id + "@" + start + "(" + kind + ")";
    }
}
