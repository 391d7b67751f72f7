package info.isaksson.erland.tracematrix.report;

import info.isaksson.erland.tracematrix.grammar.IdentifierGrammar;
import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.DuplicateDefinition;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownReportWriterTest {

    @Test
    void rendersAttentionDuplicatesAndOrphans() {
        Requirement r = new Requirement(IdentifierGrammar.parse("StR-CORE-001"), "Core clock", "P0",
                List.of("The node SHALL boot"), "docs/core.md", "0123abcd", List.of());
        CoverageReport report = new CoverageReport(75.0, Set.of("P0", "P1"), Set.of(), 1, 0, 0.0,
                Map.of(RequirementStatus.NO_TESTS, 1), List.of(r), List.of("StR-CORE-001"), List.of(),
                Set.of(), List.of(new DuplicateDefinition("REQ-F-001", 1, List.of("docs/a.md", "docs/b.md"))),
                Map.of("ADR-INFRA-001", "docs/core.md"), List.of("Test results not found: x.log"));

        String md = MarkdownReportWriter.render(report, List.of(Path.of("docs")), List.of(), null);
        assertTrue(md.contains("- Coverage: **0.0%** (threshold 75.0%) FAIL"), md);
        assertTrue(md.contains("| no-tests | 1 | 100.0% |"), md);
        assertTrue(md.contains("| _(no tests)_ | - | - | - |"), md);
        assertTrue(md.contains("1. **StR-CORE-001** (P0): Core clock"), md);
        assertTrue(md.contains("- `REQ-F-001`: 1 extra definition(s) in `docs/a.md`, `docs/b.md`"), md);
        assertTrue(md.contains("- `ADR-INFRA-001` (first seen in `docs/core.md`)"), md);
        assertTrue(md.contains("- Test results not found: x.log"), md);
        assertEquals(md, MarkdownReportWriter.render(report, List.of(Path.of("docs")), List.of(), null));
    }
}
