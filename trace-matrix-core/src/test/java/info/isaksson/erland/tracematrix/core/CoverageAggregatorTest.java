package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.grammar.IdentifierGrammar;
import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.IdentifierCategory;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.RequirementStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CoverageAggregatorTest {

    private static Requirement req(String id, String priority) {
        return new Requirement(IdentifierGrammar.parse(id), id, priority, List.of(), "docs/r.md", "00000000", List.of());
    }

    private static RequirementCatalog catalog(Requirement... reqs) {
        Map<String, Requirement> map = new LinkedHashMap<>();
        for (Requirement r : reqs) map.put(r.id.value, r);
        return new RequirementCatalog(map, List.of(), Map.of());
    }

    @Test
    void lowPriorityIsExcludedRegardlessOfStatus() {
        Requirement p0 = req("REQ-F-001", "P0");
        Requirement p2 = req("REQ-F-002", "P2").withLinks(List.of("t::a"), List.of("t::a"), List.of());

        CoverageReport report = new CoverageAggregator().aggregate(catalog(p0, p2), List.of(), Set.of(), List.of());
        assertEquals(1, report.totalRequirements);
        assertEquals(0, report.testedRequirements);
        assertEquals(0.0, report.coverage);
        assertNull(report.requirement("REQ-F-002"));
        assertEquals(List.of("REQ-F-001"), report.needingAttention);
        assertFalse(report.meetsThreshold);
    }

    @Test
    void countsStatusesAndComparesWithThreshold() {
        Requirement passing = req("REQ-F-001", "P0").withLinks(List.of("t::a"), List.of("t::a"), List.of());
        Requirement partial = req("REQ-F-002", "P1").withLinks(List.of("t::a", "t::b"), List.of("t::a"), List.of("t::b"));
        Requirement failing = req("REQ-F-003", "P1").withLinks(List.of("t::b"), List.of(), List.of("t::b"));
        Requirement none = req("REQ-F-004", "P1");

        CoverageReport report = new CoverageAggregator(List.of("P0", "P1"), Set.of(), 50.0)
                .aggregate(catalog(none, failing, partial, passing), List.of(), Set.of(), List.of());
        assertEquals(4, report.totalRequirements);
        assertEquals(2, report.testedRequirements);
        assertEquals(50.0, report.coverage);
        assertTrue(report.meetsThreshold);
        assertEquals(1, report.statusCounts.get(RequirementStatus.PASSING));
        assertEquals(1, report.statusCounts.get(RequirementStatus.PARTIAL));
        assertEquals(1, report.statusCounts.get(RequirementStatus.FAILING));
        assertEquals(1, report.statusCounts.get(RequirementStatus.NO_TESTS));
        assertEquals("REQ-F-001", report.requirements.get(0).id.value, "sorted by id");
        assertEquals(List.of("REQ-F-003", "REQ-F-004"), report.needingAttention);
    }

    @Test
    void categoryFilterNarrowsTheScope() {
        Requirement str = req("StR-CORE-001", "P0").withLinks(List.of("t::a"), List.of("t::a"), List.of());
        Requirement adr = req("ADR-INFRA-001", "P0");

        CoverageReport all = new CoverageAggregator().aggregate(catalog(str, adr), List.of(), Set.of(), List.of());
        assertEquals(2, all.totalRequirements);

        CoverageReport onlyStr = new CoverageAggregator(null, Set.of(IdentifierCategory.STAKEHOLDER_REQUIREMENT), 75.0)
                .aggregate(catalog(str, adr), List.of(), Set.of(), List.of());
        assertEquals(1, onlyStr.totalRequirements);
        assertEquals(100.0, onlyStr.coverage);
        assertEquals(Set.of("StR"), onlyStr.categories);
    }

    @Test
    void emptyScopeHasZeroCoverageAndInvalidThresholdIsRejected() {
        CoverageReport report = new CoverageAggregator().aggregate(catalog(), List.of(), Set.of(), List.of());
        assertEquals(0.0, report.coverage);
        assertThrows(IllegalArgumentException.class, () -> new CoverageAggregator(null, null, 120.0));
    }
}
