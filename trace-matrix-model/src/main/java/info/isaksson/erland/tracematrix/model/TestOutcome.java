package info.isaksson.erland.tracematrix.model;

public enum TestOutcome {
    PASSED,
    FAILED,
    /** No result could be attributed to the test. */
    UNKNOWN
}
