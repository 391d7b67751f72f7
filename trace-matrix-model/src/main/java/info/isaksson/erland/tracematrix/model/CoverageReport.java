package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Transient report model produced by coverage aggregation and consumed by the renderers.
 */
@JsonPropertyOrder({"threshold", "priorities", "categories", "totalRequirements", "testedRequirements",
        "coverage", "meetsThreshold", "statusCounts", "requirements", "needingAttention", "links",
        "unknownRequirementRefs", "duplicateDefinitions", "orphanReferences", "warnings"})
public final class CoverageReport {
    public final double threshold;
    public final Set<String> priorities;
    /** Category tags the report was restricted to; empty means all categories. */
    public final Set<String> categories;
    public final int totalRequirements;
    public final int testedRequirements;
    public final double coverage;
    public final boolean meetsThreshold;
    public final Map<RequirementStatus, Integer> statusCounts;

    /** Requirements that passed the filters, sorted by id. */
    public final List<Requirement> requirements;
    /** Filtered requirements without a passing test, in id order. */
    public final List<String> needingAttention;
    public final List<TestLink> links;
    /** Identifiers named by {@code @satisfies} annotations that are not in the catalog. */
    public final Set<String> unknownRequirementRefs;
    public final List<DuplicateDefinition> duplicateDefinitions;
    public final Map<String, String> orphanReferences;
    public final List<String> warnings;

    public CoverageReport(double threshold,
                          Set<String> priorities,
                          Set<String> categories,
                          int totalRequirements,
                          int testedRequirements,
                          double coverage,
                          Map<RequirementStatus, Integer> statusCounts,
                          List<Requirement> requirements,
                          List<String> needingAttention,
                          List<TestLink> links,
                          Set<String> unknownRequirementRefs,
                          List<DuplicateDefinition> duplicateDefinitions,
                          Map<String, String> orphanReferences,
                          List<String> warnings) {
        this.threshold = threshold;
        this.priorities = priorities == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(priorities));
        this.categories = categories == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(categories));
        this.totalRequirements = totalRequirements;
        this.testedRequirements = testedRequirements;
        this.coverage = coverage;
        this.meetsThreshold = coverage >= threshold;
        Map<RequirementStatus, Integer> counts = new LinkedHashMap<>();
        for (RequirementStatus s : RequirementStatus.values()) {
            counts.put(s, statusCounts == null ? 0 : statusCounts.getOrDefault(s, 0));
        }
        this.statusCounts = Collections.unmodifiableMap(counts);
        this.requirements = requirements == null ? List.of() : List.copyOf(requirements);
        this.needingAttention = needingAttention == null ? List.of() : List.copyOf(needingAttention);
        this.links = links == null ? List.of() : List.copyOf(links);
        this.unknownRequirementRefs = unknownRequirementRefs == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(unknownRequirementRefs));
        this.duplicateDefinitions = duplicateDefinitions == null ? List.of() : List.copyOf(duplicateDefinitions);
        this.orphanReferences = orphanReferences == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(orphanReferences));
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Requirement requirement(String id) {
        for (Requirement r : requirements) {
            if (r.id.value.equals(id)) return r;
        }
        return null;
    }
}
