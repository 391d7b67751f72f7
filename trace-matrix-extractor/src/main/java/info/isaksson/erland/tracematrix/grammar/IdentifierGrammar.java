package info.isaksson.erland.tracematrix.grammar;

import info.isaksson.erland.tracematrix.model.Identifier;
import info.isaksson.erland.tracematrix.model.IdentifierCategory;
import info.isaksson.erland.tracematrix.model.Occurrence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical grammar of traceable identifiers and the definition/reference classification of a line.
 *
 * <p>Form: {@code <CAT>(-<GROUP>)*-<digits>} where {@code CAT} is a tag of {@link IdentifierCategory}
 * and every {@code GROUP} starts with an uppercase letter ({@code REQ-AUTH-F-001}, {@code StR-CORE-001}).
 * An identifier is never glued to a word character or a dash on either side, so placeholders such as
 * {@code REQ-F-XXX} do not match.</p>
 *
 * <p>A heading line ({@code # .. ######}) whose first token is an identifier defines it. Every other
 * identifier on any line, including later ones on that same heading, is a reference.</p>
 */
public final class IdentifierGrammar {

    /** Regex source for one identifier, usable inside larger patterns. Groups are non-capturing. */
    public static final String ID_REGEX = "(?<![\\w-])(?:" + tagAlternation() + ")(?:-[A-Z][A-Z0-9]*)*-\\d+(?![\\w-])";

    private static final Pattern ID = Pattern.compile(
            "(?<![\\w-])(" + tagAlternation() + ")((?:-[A-Z][A-Z0-9]*)*)-(\\d+)(?![\\w-])");

    private static final Pattern HEADING = Pattern.compile("^\\s{0,3}#{1,6}\\s+(.*)$");

    private IdentifierGrammar() {}

    /** Parse a complete identifier (surrounding whitespace allowed). Returns null when not well-formed. */
    public static Identifier parse(String text) {
        if (text == null) return null;
        String s = text.trim();
        Matcher m = ID.matcher(s);
        if (!m.matches()) return null;
        return toIdentifier(m);
    }

    /** All identifiers in {@code line}, left to right, classified as references. */
    public static List<IdentifierToken> findAll(String line) {
        List<IdentifierToken> out = new ArrayList<>();
        if (line == null || line.isEmpty()) return out;
        Matcher m = ID.matcher(line);
        while (m.find()) {
            out.add(new IdentifierToken(toIdentifier(m), Occurrence.Kind.REFERENCE, m.start(), m.end()));
        }
        return out;
    }

    /** True for markdown ATX headings (up to three leading spaces). */
    public static boolean isHeading(String line) {
        return line != null && HEADING.matcher(line).matches();
    }

    /**
     * Identifier defined by this heading line, or null when the line is not a heading or its first
     * token is not exactly an identifier.
     */
    public static Identifier headingDefinition(String line) {
        if (line == null) return null;
        Matcher h = HEADING.matcher(line);
        if (!h.matches()) return null;
        String content = h.group(1);
        Matcher m = ID.matcher(content);
        if (!m.lookingAt()) return null;
        return toIdentifier(m);
    }

    /**
     * Classify every identifier on a line. Only the first token of a heading may be a definition.
     */
    public static List<IdentifierToken> classify(String line) {
        List<IdentifierToken> found = findAll(line);
        if (found.isEmpty()) return found;
        Identifier def = headingDefinition(line);
        if (def == null) return found;

        List<IdentifierToken> out = new ArrayList<>(found.size());
        for (int i = 0; i < found.size(); i++) {
            IdentifierToken t = found.get(i);
            if (i == 0 && t.id.equals(def)) {
                out.add(new IdentifierToken(t.id, Occurrence.Kind.DEFINITION, t.start, t.end));
            } else {
                out.add(t);
            }
        }
        return out;
    }

    /** Text of a heading after its leading {@code #} markers, or null when the line is not a heading. */
    public static String headingText(String line) {
        if (line == null) return null;
        Matcher h = HEADING.matcher(line);
        return h.matches() ? h.group(1).trim() : null;
    }

    private static Identifier toIdentifier(Matcher m) {
        String tag = m.group(1);
        String groupPart = m.group(2);
        List<String> groups = groupPart == null || groupPart.isEmpty()
                ? List.of()
                : Arrays.asList(groupPart.substring(1).split("-"));
        return new Identifier(m.group(), IdentifierCategory.fromTag(tag), groups, m.group(3));
    }

    private static String tagAlternation() {
        StringBuilder sb = new StringBuilder();
        for (IdentifierCategory c : IdentifierCategory.values()) {
            for (String t : c.tags) {
                if (sb.length() > 0) sb.append('|');
                sb.append(Pattern.quote(t));
            }
        }
        return sb.toString();
    }
}
