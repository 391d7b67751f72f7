package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * A well-formed traceable identifier, e.g. {@code REQ-AUTH-F-001}.
 *
 * <p>Instances are produced by the identifier grammar in the extractor module; the model only
 * keeps the already-split parts. Equality and ordering use the full text.</p>
 */
public final class Identifier implements Comparable<Identifier> {
    public final String value;
    public final IdentifierCategory category;
    /** Secondary grouping tags between category and number (may be empty). */
    public final List<String> groups;
    /** Numeric suffix as written (leading zeros kept). */
    public final String number;

    public Identifier(String value, IdentifierCategory category, List<String> groups, String number) {
        this.value = Objects.requireNonNull(value, "value");
        this.category = Objects.requireNonNull(category, "category");
        this.groups = groups == null ? List.of() : List.copyOf(groups);
        this.number = Objects.requireNonNull(number, "number");
    }

    @JsonValue
    public String asString() {
        return value;
    }

    @Override
    public int compareTo(Identifier o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        return value.equals(((Identifier) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
