package info.isaksson.erland.tracematrix.grammar;

import info.isaksson.erland.tracematrix.model.Identifier;
import info.isaksson.erland.tracematrix.model.IdentifierCategory;
import info.isaksson.erland.tracematrix.model.Occurrence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierGrammarTest {

    @Test
    void parsesCategoryGroupsAndNumber() {
        Identifier id = IdentifierGrammar.parse("REQ-AUTH-F-001");
        assertNotNull(id);
        assertEquals(IdentifierCategory.REQUIREMENT, id.category);
        assertEquals(List.of("AUTH", "F"), id.groups);
        assertEquals("001", id.number);

        Identifier str = IdentifierGrammar.parse(" StR-CORE-001 ");
        assertNotNull(str);
        assertEquals("StR-CORE-001", str.value);
        assertEquals(IdentifierCategory.STAKEHOLDER_REQUIREMENT, str.category);

        Identifier plain = IdentifierGrammar.parse("ADR-7");
        assertNotNull(plain);
        assertTrue(plain.groups.isEmpty());
    }

    @Test
    void rejectsPlaceholdersAndGluedTokens() {
        assertNull(IdentifierGrammar.parse("REQ-F-XXX"));
        assertNull(IdentifierGrammar.parse("REQ-f-001"));
        assertNull(IdentifierGrammar.parse("BUG-001"));
        assertTrue(IdentifierGrammar.findAll("see REQ-F-XXX and xREQ-F-001 and REQ-F-001-draft").isEmpty());
        assertTrue(IdentifierGrammar.findAll("ID-REQ-F-001").isEmpty());
    }

    @Test
    void findsEveryIdentifierOnALine() {
        List<IdentifierToken> tokens = IdentifierGrammar.findAll("Traces to StR-CORE-001, ADR-INFRA-001 and (QA-PERF-002).");
        assertEquals(3, tokens.size());
        assertEquals("StR-CORE-001", tokens.get(0).id.value);
        assertEquals("ADR-INFRA-001", tokens.get(1).id.value);
        assertEquals("QA-PERF-002", tokens.get(2).id.value);
        for (IdentifierToken t : tokens) {
            assertEquals(Occurrence.Kind.REFERENCE, t.kind);
        }
    }

    @Test
    void headingFirstTokenIsTheOnlyDefinition() {
        List<IdentifierToken> tokens = IdentifierGrammar.classify("## REQ-F-001: Login (refines StR-CORE-001)");
        assertEquals(2, tokens.size());
        assertTrue(tokens.get(0).isDefinition());
        assertFalse(tokens.get(1).isDefinition());

        List<IdentifierToken> notFirst = IdentifierGrammar.classify("## Login for REQ-F-001");
        assertEquals(1, notFirst.size());
        assertFalse(notFirst.get(0).isDefinition());

        assertNull(IdentifierGrammar.headingDefinition("REQ-F-001 outside a heading"));
        assertNull(IdentifierGrammar.headingDefinition("    # REQ-F-001 indented code"));
    }
}
