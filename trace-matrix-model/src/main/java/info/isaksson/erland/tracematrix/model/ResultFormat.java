package info.isaksson.erland.tracematrix.model;

/** Format a results file was recognized as. */
public enum ResultFormat {
    /** Element-per-test XML (CTest {@code Test.xml} style). */
    XML,
    /** {@code Test #<n>: <name> .... Passed} lines. */
    LEGACY_LOG,
    /** {@code <i>/<n> Testing: <name>} blocks closed by {@code Test Passed.}/{@code Test Failed.}. */
    BLOCK_LOG,
    /** Missing file or nothing recognized. */
    NONE
}
