package info.isaksson.erland.tracematrix.model;

/** How a test annotation was tied to a result name. */
public enum MatchConfidence {
    /** Result name contains the test's short name. */
    EXACT,
    /** A single result name contains the test name's most discriminating token. */
    HEURISTIC,
    UNRESOLVED
}
