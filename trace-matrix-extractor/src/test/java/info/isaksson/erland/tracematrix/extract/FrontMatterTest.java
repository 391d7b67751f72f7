package info.isaksson.erland.tracematrix.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FrontMatterTest {

    @Test
    void readsFlatKeysAndUnquotes() throws Exception {
        FrontMatter fm = FrontMatter.parse("x.md", List.of("---", "id: 'REQ-F-001'", "title: \"Login\"", "# note: skipped", "---", "body"));
        assertEquals("REQ-F-001", fm.get("id"));
        assertEquals("Login", fm.get("title"));
        assertNull(fm.get("# note"));
        assertEquals(5, fm.bodyStart);
        assertEquals(1, fm.keyLines.get("id"));
    }

    @Test
    void absentFrontMatterIsEmpty() throws Exception {
        FrontMatter fm = FrontMatter.parse("x.md", List.of("# Title", "---"));
        assertTrue(fm.isEmpty());
        assertEquals(0, fm.bodyStart);
    }

    @Test
    void sequencesAreJoinedAndEveryNestedScalarIsKept() throws Exception {
        FrontMatter fm = FrontMatter.parse("x.md", List.of(
                "---", "id: REQ-F-001", "traces:", "  - ADR-INFRA-001", "  - REQ-F-009",
                "meta:", "  owner: team", "  tags: [QA-PERF-001]", "empty:", "---"));
        assertEquals("ADR-INFRA-001, REQ-F-009", fm.get("traces"));
        assertEquals(List.of("ADR-INFRA-001", "REQ-F-009"), fm.texts.get("traces"));
        assertEquals(List.of("owner", "team", "tags", "QA-PERF-001"), fm.texts.get("meta"));
        assertEquals("", fm.get("empty"));
        assertEquals(2, fm.keyLines.get("traces"));
        assertEquals(5, fm.keyLines.get("meta"));
        assertEquals(10, fm.bodyStart);
    }

    @Test
    void emptyBlockHasNoValues() throws Exception {
        FrontMatter fm = FrontMatter.parse("x.md", List.of("---", "---", "body"));
        assertTrue(fm.values.isEmpty());
        assertEquals(2, fm.bodyStart);
    }

    @Test
    void malformedYamlAndNonMappingsAreRejected() {
        assertThrows(DocumentParseException.class,
                () -> FrontMatter.parse("x.md", List.of("---", "id: [unclosed", "---")));
        assertThrows(DocumentParseException.class,
                () -> FrontMatter.parse("x.md", List.of("---", "- just", "- a list", "---")));
    }
}
