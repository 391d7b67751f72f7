package info.isaksson.erland.tracematrix.grammar;

import info.isaksson.erland.tracematrix.model.Identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line matchers for the structural markers around identifiers: priority bullets, obligation bullets,
 * acceptance criteria labels, fences and {@code @satisfies} annotations.
 */
public final class StructuralMarkers {

    private static final Pattern PRIORITY_VALUE = Pattern.compile("^P\\d+$", Pattern.CASE_INSENSITIVE);

    // "- priority: P0", "* **Priority**: P1"
    private static final Pattern PRIORITY_BULLET = Pattern.compile(
            "^\\s*[-*+]\\s+\\**\\s*priority\\s*\\**\\s*:\\s*\\**\\s*(P\\d+)\\b", Pattern.CASE_INSENSITIVE);

    // "Title (P0)" at the end of a heading
    private static final Pattern HEADING_PRIORITY_SUFFIX = Pattern.compile("\\s*\\(\\s*(P\\d+)\\s*\\)\\s*$");

    private static final Pattern BULLET = Pattern.compile("^\\s*[-*+]\\s+(.*)$");
    private static final Pattern OBLIGATION = Pattern.compile("\\b(SHALL|MUST)\\b");

    private static final Pattern ACCEPTANCE_LABEL = Pattern.compile(
            "^\\s*(?:#{1,6}\\s+)?\\**\\s*acceptance\\s+criteria\\s*\\**\\s*:?\\s*\\**\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern FENCE = Pattern.compile("^\\s*(```|~~~).*$");

    private static final Pattern SATISFIES = Pattern.compile(
            "(?://+|#+|/\\*+|\\*+|--)\\s*@satisfies\\s*:?\\s+(" + IdentifierGrammar.ID_REGEX
                    + "(?:\\s*,\\s*" + IdentifierGrammar.ID_REGEX + ")*)");

    private StructuralMarkers() {}

    /** Normalized priority ({@code P0}..{@code Pn}) or null when {@code value} is not one. */
    public static String normalizePriority(String value) {
        if (value == null) return null;
        String s = value.trim();
        if (!PRIORITY_VALUE.matcher(s).matches()) return null;
        return s.toUpperCase(Locale.ROOT);
    }

    /** Priority declared by a bullet line such as {@code - priority: P0}, or null. */
    public static String priorityBullet(String line) {
        if (line == null) return null;
        Matcher m = PRIORITY_BULLET.matcher(line);
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : null;
    }

    /** Priority written as a {@code (P<n>)} suffix of a heading title, or null. */
    public static String headingPriority(String headingTitle) {
        if (headingTitle == null) return null;
        Matcher m = HEADING_PRIORITY_SUFFIX.matcher(headingTitle);
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : null;
    }

    /** Heading title without a trailing {@code (P<n>)} suffix. */
    public static String stripHeadingPriority(String headingTitle) {
        if (headingTitle == null) return null;
        return HEADING_PRIORITY_SUFFIX.matcher(headingTitle).replaceFirst("");
    }

    /** Bullet text of a line containing SHALL or MUST, bullet marker removed; null otherwise. */
    public static String obligationBullet(String line) {
        if (line == null) return null;
        Matcher b = BULLET.matcher(line);
        if (!b.matches()) return null;
        String text = b.group(1).trim();
        return OBLIGATION.matcher(text).find() ? text : null;
    }

    public static boolean isAcceptanceCriteriaLabel(String line) {
        return line != null && ACCEPTANCE_LABEL.matcher(line).matches();
    }

    public static boolean isFence(String line) {
        return line != null && FENCE.matcher(line).matches();
    }

    /** Comment line inside a criteria block. */
    public static boolean isCommentLine(String trimmed) {
        return trimmed.startsWith("#") || trimmed.startsWith("//");
    }

    /**
     * Identifiers named by a {@code @satisfies} annotation on this line (a comment marker, the tag,
     * then one or more comma separated identifiers). Empty when the line carries no annotation.
     */
    public static List<Identifier> satisfies(String line) {
        List<Identifier> out = new ArrayList<>();
        if (line == null || !line.contains("@satisfies")) return out;
        Matcher m = SATISFIES.matcher(line);
        while (m.find()) {
            for (IdentifierToken t : IdentifierGrammar.findAll(m.group(1))) {
                out.add(t.id);
            }
        }
        return out;
    }
}
