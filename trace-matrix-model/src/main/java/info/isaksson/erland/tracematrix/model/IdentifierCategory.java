package info.isaksson.erland.tracematrix.model;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of identifier categories. Each category owns one or more lexical tags
 * (the leading part of an identifier such as {@code StR} in {@code StR-CORE-001}).
 */
public enum IdentifierCategory {
    /** Stakeholder requirement (both spellings are in use). */
    STAKEHOLDER_REQUIREMENT("StR", "STR"),
    /** Functional / non-functional system requirement. */
    REQUIREMENT("REQ"),
    ARCHITECTURE_ELEMENT("ARC"),
    DECISION_RECORD("ADR"),
    QUALITY_ATTRIBUTE("QA"),
    TEST_CASE("TEST");

    public final List<String> tags;

    IdentifierCategory(String... tags) {
        this.tags = List.of(tags);
    }

    /** Primary tag used when rendering the category. */
    public String primaryTag() {
        return tags.get(0);
    }

    /** Returns the category owning {@code tag} (exact, case-sensitive), or null. */
    public static IdentifierCategory fromTag(String tag) {
        if (tag == null) return null;
        for (IdentifierCategory c : values()) {
            if (c.tags.contains(tag)) return c;
        }
        return null;
    }

    /** Accepts a tag ({@code StR}, {@code req}) or an enum name ({@code decision_record}). */
    public static IdentifierCategory parseCli(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Missing value for --categories");
        }
        String s = v.trim();
        for (IdentifierCategory c : values()) {
            if (c.name().equalsIgnoreCase(s)) return c;
            for (String t : c.tags) {
                if (t.equalsIgnoreCase(s)) return c;
            }
        }
        throw new IllegalArgumentException("Invalid value for --categories: " + v
                + " (expected one of: StR|REQ|ARC|ADR|QA|TEST)");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
