package info.isaksson.erland.tracematrix.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RequirementTest {

    private static Requirement req(String id) {
        return new Requirement(new Identifier(id, IdentifierCategory.REQUIREMENT, List.of("F"), "001"),
                "Title", null, null, "docs/req.md", "abcdef12", null);
    }

    @Test
    void noTestsMeansZeroCoverage() {
        Requirement r = req("REQ-F-001");
        assertEquals(RequirementStatus.NO_TESTS, r.status());
        assertEquals(0.0, r.coverage());
        assertFalse(r.isTested());
        assertEquals("P1", r.priority, "default priority");
    }

    @Test
    void allPassingIsFullCoverage() {
        Requirement r = req("REQ-F-001").withLinks(List.of("a::x", "a::y"), List.of("a::x", "a::y"), List.of());
        assertEquals(RequirementStatus.PASSING, r.status());
        assertEquals(100.0, r.coverage());
        assertTrue(r.isTested());
    }

    @Test
    void unresolvedTestsLowerCoverageButNotStatus() {
        Requirement r = req("REQ-F-001").withLinks(List.of("a::x", "a::y"), List.of("a::x"), List.of());
        assertEquals(RequirementStatus.PASSING, r.status());
        assertEquals(50.0, r.coverage());
    }

    @Test
    void mixedOutcomesArePartial() {
        Requirement r = req("REQ-F-001").withLinks(List.of("a::x", "a::y"), List.of("a::x"), List.of("a::y"));
        assertEquals(RequirementStatus.PARTIAL, r.status());
        assertEquals(50.0, r.coverage());
    }

    @Test
    void onlyFailingIsFailing() {
        Requirement r = req("REQ-F-001").withLinks(List.of("a::x"), List.of(), List.of("a::x"));
        assertEquals(RequirementStatus.FAILING, r.status());
        assertEquals(0.0, r.coverage());
        assertFalse(r.isTested());
    }

    @Test
    void rejectsOverlappingOrUnlinkedOutcomes() {
        Requirement r = req("REQ-F-001");
        assertThrows(IllegalArgumentException.class,
                () -> r.withLinks(List.of("a::x"), List.of("a::x"), List.of("a::x")));
        assertThrows(IllegalArgumentException.class,
                () -> r.withLinks(List.of("a::x"), List.of("a::y"), List.of()));
    }

    @Test
    void withLinksLeavesOriginalUntouched() {
        Requirement r = req("REQ-F-001");
        Requirement linked = r.withLinks(Set.of("a::x"), Set.of("a::x"), Set.of());
        assertTrue(r.testCases.isEmpty());
        assertEquals(Set.of("a::x"), linked.testCases);
        assertEquals(r.title, linked.title);
        assertEquals(r.contentHash, linked.contentHash);
    }
}
