package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Passing and failing test names parsed from a results file. A name is in at most one set.
 */
@JsonPropertyOrder({"format", "passing", "failing"})
public final class ResultSets {
    public final ResultFormat format;
    public final Set<String> passing;
    public final Set<String> failing;

    public ResultSets(ResultFormat format, Set<String> passing, Set<String> failing) {
        this.format = format == null ? ResultFormat.NONE : format;
        this.passing = passing == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(passing));
        this.failing = failing == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(failing));
    }

    public static ResultSets empty() {
        return new ResultSets(ResultFormat.NONE, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return passing.isEmpty() && failing.isEmpty();
    }

    public int size() {
        return passing.size() + failing.size();
    }
}
