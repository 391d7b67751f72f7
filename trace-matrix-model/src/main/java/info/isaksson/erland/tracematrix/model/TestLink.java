package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Resolution of one annotated test against the parsed results. */
@JsonPropertyOrder({"testId", "shortName", "requirementIds", "outcome", "confidence", "matchedResult"})
public final class TestLink {
    public final String testId;
    public final String shortName;
    public final List<String> requirementIds;
    public final TestOutcome outcome;
    public final MatchConfidence confidence;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String matchedResult;

    public TestLink(String testId,
                    String shortName,
                    List<String> requirementIds,
                    TestOutcome outcome,
                    MatchConfidence confidence,
                    String matchedResult) {
        this.testId = Objects.requireNonNull(testId, "testId");
        this.shortName = shortName == null ? testId : shortName;
        this.requirementIds = requirementIds == null ? List.of() : List.copyOf(requirementIds);
        this.outcome = outcome == null ? TestOutcome.UNKNOWN : outcome;
        this.confidence = confidence == null ? MatchConfidence.UNRESOLVED : confidence;
        this.matchedResult = matchedResult;
        if (this.confidence == MatchConfidence.UNRESOLVED && this.outcome != TestOutcome.UNKNOWN) {
            throw new IllegalArgumentException("Unresolved link cannot carry outcome " + this.outcome);
        }
    }

    public static TestLink unresolved(String testId, String shortName, List<String> requirementIds) {
        return new TestLink(testId, shortName, requirementIds, TestOutcome.UNKNOWN, MatchConfidence.UNRESOLVED, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return confidence != MatchConfidence.UNRESOLVED;
    }

    @Override
    public String toString() {
        return testId + " " + outcome + " (" + confidence + (matchedResult == null ? "" : " via " + matchedResult) + ")";
    }
}
