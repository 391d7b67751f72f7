package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

/** Verification state derived from a requirement's linked tests. */
public enum RequirementStatus {
    NO_TESTS("no-tests"),
    PASSING("passing"),
    PARTIAL("partial"),
    FAILING("failing");

    public final String label;

    RequirementStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static RequirementStatus of(Collection<?> testCases, Collection<?> passing, Collection<?> failing) {
        if (testCases == null || testCases.isEmpty()) return NO_TESTS;
        if (failing == null || failing.isEmpty()) return PASSING;
        if (passing != null && !passing.isEmpty()) return PARTIAL;
        return FAILING;
    }
}
