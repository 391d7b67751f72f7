package info.isaksson.erland.tracematrix.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierCategoryTest {

    @Test
    void bothStakeholderSpellingsMapToOneCategory() {
        assertEquals(IdentifierCategory.STAKEHOLDER_REQUIREMENT, IdentifierCategory.fromTag("StR"));
        assertEquals(IdentifierCategory.STAKEHOLDER_REQUIREMENT, IdentifierCategory.fromTag("STR"));
        assertNull(IdentifierCategory.fromTag("str"));
        assertNull(IdentifierCategory.fromTag("FOO"));
    }

    @Test
    void parseCliAcceptsTagsAndNames() {
        assertEquals(IdentifierCategory.REQUIREMENT, IdentifierCategory.parseCli("req"));
        assertEquals(IdentifierCategory.DECISION_RECORD, IdentifierCategory.parseCli(" decision_record "));
        assertEquals(IdentifierCategory.STAKEHOLDER_REQUIREMENT, IdentifierCategory.parseCli("StR"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> IdentifierCategory.parseCli("BUG"));
        assertTrue(ex.getMessage().contains("BUG"));
    }
}
