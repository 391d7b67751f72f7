package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TraceJsonDeterminismTest {

    private static CoverageReport sampleReport() {
        Identifier id = new Identifier("StR-CORE-001", IdentifierCategory.STAKEHOLDER_REQUIREMENT, List.of("CORE"), "001");
        Requirement r = new Requirement(id, "Core", "P0", List.of("The system SHALL boot"),
                "docs/core.md", "0123abcd", List.of("REQ-F-001"))
                .withLinks(List.of("tests/test_core.cpp::boots"), List.of("tests/test_core.cpp::boots"), List.of());
        TestLink link = new TestLink("tests/test_core.cpp::boots", "boots", List.of("StR-CORE-001"),
                TestOutcome.PASSED, MatchConfidence.EXACT, "core_boots");
        return new CoverageReport(75.0, Set.of("P1", "P0"), Set.of(), 1, 1, 100.0,
                Map.of(RequirementStatus.PASSING, 1), List.of(r), List.of(), List.of(link), Set.of("REQ-X-009"),
                List.of(), Map.of("ADR-INFRA-001", "docs/core.md"), List.of());
    }

    @Test
    void writingTwiceIsByteIdentical() throws Exception {
        Path dir = Files.createTempDirectory("trace-json-");
        Path a = dir.resolve("a/trace.json");
        Path b = dir.resolve("b/trace.json");
        TraceJson.write(sampleReport(), a);
        TraceJson.write(sampleReport(), b);

        String first = Files.readString(a, StandardCharsets.UTF_8);
        assertEquals(first, Files.readString(b, StandardCharsets.UTF_8));
        assertTrue(first.endsWith("}\n"));
        assertEquals(first, TraceJson.toJsonString(sampleReport()));
    }

    @Test
    void requirementCarriesDerivedFields() throws Exception {
        JsonNode root = new ObjectMapper().readTree(TraceJson.toJsonString(sampleReport()));
        JsonNode req = root.get("requirements").get(0);
        assertEquals("StR-CORE-001", req.get("id").asText());
        assertEquals("passing", req.get("status").asText());
        assertEquals(100.0, req.get("coverage").asDouble());
        assertTrue(req.get("tested").asBoolean());
        assertTrue(root.get("meetsThreshold").asBoolean());
        assertEquals("P0", root.get("priorities").get(0).asText(), "priorities are sorted");

        JsonNode link = root.get("links").get(0);
        assertEquals("exact", link.get("confidence").asText().toLowerCase());
        assertFalse(link.has("resolved"));
    }

    @Test
    void unresolvedLinkOmitsMatchedResult() throws Exception {
        TestLink l = TestLink.unresolved("t.cpp::x", "x", List.of("REQ-F-001"));
        JsonNode node = new ObjectMapper().readTree(TraceJson.toJsonString(l));
        assertFalse(node.has("matchedResult"));
        assertEquals("UNKNOWN", node.get("outcome").asText());
        assertThrows(IllegalArgumentException.class, () -> new TestLink("t.cpp::x", "x", List.of(),
                TestOutcome.PASSED, MatchConfidence.UNRESOLVED, null));
    }
}
