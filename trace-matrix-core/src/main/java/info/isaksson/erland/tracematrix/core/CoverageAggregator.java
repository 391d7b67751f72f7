package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.IdentifierCategory;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.RequirementStatus;
import info.isaksson.erland.tracematrix.model.TestLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Filters linked requirements by priority (and optionally category) and computes the overall coverage verdict.
 */
public final class CoverageAggregator {

    private static final Logger log = LoggerFactory.getLogger(CoverageAggregator.class);

    public static final List<String> DEFAULT_PRIORITIES = List.of("P0", "P1");
    public static final double DEFAULT_THRESHOLD = 75.0;

    private final Set<String> priorities;
    private final Set<IdentifierCategory> categories;
    private final double threshold;

    public CoverageAggregator() {
        this(DEFAULT_PRIORITIES, Set.of(), DEFAULT_THRESHOLD);
    }

    /**
     * @param priorities priorities to include; null or empty means {@link #DEFAULT_PRIORITIES}
     * @param categories categories to include; null or empty means all categories
     * @param threshold  minimum overall coverage percent
     */
    public CoverageAggregator(Iterable<String> priorities, Set<IdentifierCategory> categories, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 100.0) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100: " + threshold);
        }
        Set<String> p = new LinkedHashSet<>();
        if (priorities != null) {
            for (String s : priorities) {
                if (s != null && !s.isBlank()) p.add(s.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.priorities = p.isEmpty() ? new LinkedHashSet<>(DEFAULT_PRIORITIES) : p;
        this.categories = categories == null ? Set.of() : Set.copyOf(categories);
        this.threshold = threshold;
    }

    public boolean includes(Requirement r) {
        if (!priorities.contains(r.priority)) return false;
        return categories.isEmpty() || categories.contains(r.id.category);
    }

    public CoverageReport aggregate(RequirementCatalog linked,
                                    List<TestLink> links,
                                    Set<String> unknownRequirementRefs,
                                    List<String> warnings) {
        List<Requirement> filtered = new ArrayList<>();
        for (Requirement r : linked.requirements()) {
            if (includes(r)) filtered.add(r);
        }
        filtered.sort(Comparator.comparing(r -> r.id));

        Map<RequirementStatus, Integer> counts = new EnumMap<>(RequirementStatus.class);
        List<String> needingAttention = new ArrayList<>();
        int tested = 0;
        for (Requirement r : filtered) {
            counts.merge(r.status(), 1, Integer::sum);
            if (r.isTested()) {
                tested++;
            } else {
                needingAttention.add(r.id.value);
            }
        }
        double overall = filtered.isEmpty() ? 0.0 : tested * 100.0 / filtered.size();

        Set<String> categoryTags = new LinkedHashSet<>();
        for (IdentifierCategory c : categories) categoryTags.add(c.primaryTag());

        log.info("Coverage {}/{} requirement(s) = {}% (threshold {}%)",
                tested, filtered.size(), String.format(Locale.ROOT, "%.1f", overall), threshold);

        return new CoverageReport(threshold, priorities, categoryTags,
                filtered.size(), tested, overall, counts, filtered, needingAttention,
                links, unknownRequirementRefs, linked.conflicts, linked.orphanReferences, warnings);
    }
}
