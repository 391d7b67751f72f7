package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical requirement record (one per defined identifier).
 *
 * <p>Instances are immutable. The definition index creates them without test links; linking
 * produces new instances through {@link #withLinks(Collection, Collection, Collection)}.</p>
 */
@JsonPropertyOrder({"id", "title", "priority", "status", "coverage", "tested", "acceptanceCriteria", "sourcePath",
        "contentHash", "references", "testCases", "passingTests", "failingTests"})
public final class Requirement {
    public static final String DEFAULT_PRIORITY = "P1";

    public final Identifier id;
    public final String title;
    public final String priority;
    public final List<String> acceptanceCriteria;
    public final String sourcePath;
    public final String contentHash;
    /** Other identifiers mentioned in the defining document, sorted. */
    public final List<String> references;

    public final Set<String> testCases;
    public final Set<String> passingTests;
    public final Set<String> failingTests;

    public Requirement(Identifier id,
                       String title,
                       String priority,
                       List<String> acceptanceCriteria,
                       String sourcePath,
                       String contentHash,
                       List<String> references) {
        this(id, title, priority, acceptanceCriteria, sourcePath, contentHash, references, null, null, null);
    }

    private Requirement(Identifier id,
                        String title,
                        String priority,
                        List<String> acceptanceCriteria,
                        String sourcePath,
                        String contentHash,
                        List<String> references,
                        Collection<String> testCases,
                        Collection<String> passingTests,
                        Collection<String> failingTests) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title;
        this.priority = priority == null || priority.isBlank() ? DEFAULT_PRIORITY : priority;
        this.acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        this.sourcePath = sourcePath == null ? "" : sourcePath;
        this.contentHash = contentHash == null ? "" : contentHash;
        this.references = references == null ? List.of() : List.copyOf(references);
        this.testCases = frozen(testCases);
        this.passingTests = frozen(passingTests);
        this.failingTests = frozen(failingTests);

        for (String t : this.passingTests) {
            if (this.failingTests.contains(t)) {
                throw new IllegalArgumentException("Test " + t + " is both passing and failing for " + id);
            }
            if (!this.testCases.contains(t)) {
                throw new IllegalArgumentException("Passing test " + t + " is not linked to " + id);
            }
        }
        for (String t : this.failingTests) {
            if (!this.testCases.contains(t)) {
                throw new IllegalArgumentException("Failing test " + t + " is not linked to " + id);
            }
        }
    }

    /** Copy of this requirement with the given test links (previous links are replaced). */
    public Requirement withLinks(Collection<String> testCases, Collection<String> passing, Collection<String> failing) {
        return new Requirement(id, title, priority, acceptanceCriteria, sourcePath, contentHash, references,
                testCases, passing, failing);
    }

    @JsonProperty("status")
    public RequirementStatus status() {
        return RequirementStatus.of(testCases, passingTests, failingTests);
    }

    /** Percentage of linked tests that pass; 0 without tests. */
    @JsonProperty("coverage")
    public double coverage() {
        if (testCases.isEmpty()) return 0.0;
        return passingTests.size() * 100.0 / testCases.size();
    }

    /** Has at least one passing test. */
    @JsonProperty("tested")
    public boolean isTested() {
        return !passingTests.isEmpty();
    }

    private static Set<String> frozen(Collection<String> in) {
        if (in == null || in.isEmpty()) return Set.of();
        return Collections.unmodifiableSet(new LinkedHashSet<>(in));
    }

    @Override
    public String toString() {
        return id + " (" + priority + ") " + title;
    }
}
