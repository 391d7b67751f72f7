package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A test declared in source together with the requirement identifiers it claims to satisfy. */
@JsonPropertyOrder({"testId", "shortName", "requirementIds", "fileLevel"})
public final class TestAnnotation {
    public static final String SEPARATOR = "::";

    /** {@code <relative file path>::<test name>}. */
    public final String testId;
    public final List<String> requirementIds;
    /** True when no test declaration was found and the whole file stands in for the test. */
    public final boolean fileLevel;

    public TestAnnotation(String testId, List<String> requirementIds, boolean fileLevel) {
        this.testId = Objects.requireNonNull(testId, "testId");
        this.requirementIds = requirementIds == null ? List.of() : List.copyOf(requirementIds);
        this.fileLevel = fileLevel;
    }

    public static String testId(String relativePath, String testName) {
        return relativePath + SEPARATOR + testName;
    }

    /** Test name with the file path portion removed (the text after the last separator). */
    @JsonProperty("shortName")
    public String shortName() {
        int idx = testId.lastIndexOf(SEPARATOR);
        return idx < 0 ? testId : testId.substring(idx + SEPARATOR.length());
    }

    @Override
    public String toString() {
        return testId + " -> " + requirementIds;
    }
}
