package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.grammar.IdentifierGrammar;
import info.isaksson.erland.tracematrix.grammar.IdentifierToken;
import info.isaksson.erland.tracematrix.grammar.StructuralMarkers;
import info.isaksson.erland.tracematrix.io.TextFiles;
import info.isaksson.erland.tracematrix.model.Identifier;
import info.isaksson.erland.tracematrix.model.Occurrence;
import info.isaksson.erland.tracematrix.model.ScannedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parse one requirement document into its identifier occurrences.
 *
 * <p>Definitions are the front matter {@code id} and headings whose first token is an identifier. Each
 * definition heading opens a section running to the next definition heading; the front matter definition
 * owns the text between the front matter and the first definition heading. Priority and acceptance
 * criteria are read from the definition's section:</p>
 * <ul>
 *   <li>priority: front matter {@code priority} (primary id only), a {@code (P<n>)} heading suffix, or the
 *   first {@code - priority: P<n>} bullet of the section</li>
 *   <li>criteria: bullets containing SHALL/MUST, and each non-empty, non-comment line of a fenced block
 *   following an "Acceptance Criteria" label</li>
 * </ul>
 *
 * <p>Lines inside fenced code blocks never define anything; identifiers there are references.</p>
 *
 * <p>An identifier is defined at most once per document. When the front matter id reappears as a heading
 * the two collapse into one definition; the heading contributes whatever the front matter does not state.</p>
 */
public final class RequirementDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(RequirementDocumentParser.class);

    private static final String TITLE_TRIM = " -:,\t";

    /**
     * Parse a document from disk.
     *
     * @param displayPath path recorded on occurrences ('/' separated)
     * @throws DocumentParseException when the file is not valid UTF-8 or its front matter is malformed
     */
    public ScannedDocument parse(Path file, String displayPath) throws IOException, DocumentParseException {
        String text;
        try {
            text = TextFiles.readStrict(file);
        } catch (CharacterCodingException e) {
            throw new DocumentParseException(displayPath, "not valid UTF-8", e);
        }
        return parseText(displayPath, TextFiles.stem(file.getFileName().toString()), text);
    }

    public ScannedDocument parseText(String path, String stem, String text) throws DocumentParseException {
        List<String> lines = TextFiles.lines(text);
        FrontMatter fm = FrontMatter.parse(path, lines);
        Identifier primary = primaryId(path, fm);
        final int body = fm.bodyStart;

        // 1) Definition headings (section boundaries)
        List<HeadingDefinition> headings = new ArrayList<>();
        Set<Identifier> definedHere = new HashSet<>();
        if (primary != null) definedHere.add(primary);
        HeadingDefinition primaryHeading = null;

        boolean inFence = false;
        for (int i = body; i < lines.size(); i++) {
            if (StructuralMarkers.isFence(lines.get(i))) {
                inFence = !inFence;
                continue;
            }
            if (inFence) continue;
            Identifier id = IdentifierGrammar.headingDefinition(lines.get(i));
            if (id == null) continue;
            if (id.equals(primary)) {
                if (primaryHeading == null) {
                    primaryHeading = new HeadingDefinition(i, id, lines.get(i), true);
                    headings.add(primaryHeading);
                }
                continue;
            }
            if (!definedHere.add(id)) {
                log.debug("{}:{} repeats definition heading of {} (kept as reference)", path, i + 1, id);
                continue;
            }
            headings.add(new HeadingDefinition(i, id, lines.get(i), false));
        }

        Map<Integer, HeadingDefinition> headingByLine = new HashMap<>();
        for (int k = 0; k < headings.size(); k++) {
            HeadingDefinition h = headings.get(k);
            int end = k + 1 < headings.size() ? headings.get(k + 1).line : lines.size();
            h.section = Section.read(lines, h.line + 1, end);
            headingByLine.put(h.line, h);
        }

        List<Occurrence> out = new ArrayList<>();

        // 2) Front matter definition (collapsed with its heading, if any)
        if (primary != null) {
            int firstHeading = headings.isEmpty() ? lines.size() : headings.get(0).line;
            Section lead = Section.read(lines, body, firstHeading);

            String title = fm.get("title");
            if (title == null || title.isBlank()) {
                title = primaryHeading != null ? primaryHeading.title(stem) : stem;
            }

            String priority = StructuralMarkers.normalizePriority(fm.get("priority"));
            if (priority == null && primaryHeading != null) priority = primaryHeading.suffixPriority;
            if (priority == null) priority = lead.priority;
            if (priority == null && primaryHeading != null) priority = primaryHeading.section.priority;

            List<String> criteria = new ArrayList<>(lead.criteria);
            if (primaryHeading != null) criteria.addAll(primaryHeading.section.criteria);

            out.add(Occurrence.definition(primary, path, 0, title, priority, criteria));
        }

        // 3) References inside front matter values
        for (Map.Entry<String, List<String>> e : fm.texts.entrySet()) {
            if ("id".equals(e.getKey())) continue;
            int line = fm.keyLines.getOrDefault(e.getKey(), 0) + 1;
            for (String value : e.getValue()) {
                for (IdentifierToken t : IdentifierGrammar.findAll(value)) {
                    out.add(Occurrence.reference(t.id, path, line));
                }
            }
        }

        // 4) Body; fenced lines only hold references
        inFence = false;
        for (int i = body; i < lines.size(); i++) {
            boolean fenceLine = StructuralMarkers.isFence(lines.get(i));
            if (fenceLine) inFence = !inFence;
            if (fenceLine || inFence) {
                for (IdentifierToken t : IdentifierGrammar.findAll(lines.get(i))) {
                    out.add(Occurrence.reference(t.id, path, i + 1));
                }
                continue;
            }
            for (IdentifierToken t : IdentifierGrammar.classify(lines.get(i))) {
                if (t.isDefinition()) {
                    HeadingDefinition h = headingByLine.get(i);
                    if (h != null && h.id.equals(t.id)) {
                        if (h.primary) continue;
                        out.add(Occurrence.definition(t.id, path, i + 1, h.title(stem), h.priority(), h.section.criteria));
                        continue;
                    }
                }
                out.add(Occurrence.reference(t.id, path, i + 1));
            }
        }

        return new ScannedDocument(path, TextFiles.sha1Prefix(text, 8), fm.values, out);
    }

    private static Identifier primaryId(String path, FrontMatter fm) {
        String raw = fm.get("id");
        if (raw == null || raw.isBlank()) return null;
        Identifier id = IdentifierGrammar.parse(raw);
        if (id == null) {
            log.debug("{}: front matter id '{}' is not a well-formed identifier", path, raw);
        }
        return id;
    }

    private static final class HeadingDefinition {
        final int line;
        final Identifier id;
        final boolean primary;
        final String rawTitle;
        final String suffixPriority;
        Section section = Section.EMPTY;

        HeadingDefinition(int line, Identifier id, String headingLine, boolean primary) {
            this.line = line;
            this.id = id;
            this.primary = primary;
            String text = IdentifierGrammar.headingText(headingLine);
            String rest = text == null || text.length() < id.value.length() ? "" : text.substring(id.value.length());
            String trimmed = trim(rest);
            this.suffixPriority = StructuralMarkers.headingPriority(trimmed);
            this.rawTitle = trim(StructuralMarkers.stripHeadingPriority(trimmed));
        }

        String title(String fallback) {
            return rawTitle.isEmpty() ? fallback : rawTitle;
        }

        String priority() {
            return suffixPriority != null ? suffixPriority : section.priority;
        }

        private static String trim(String s) {
            int start = 0;
            int end = s.length();
            while (start < end && TITLE_TRIM.indexOf(s.charAt(start)) >= 0) start++;
            while (end > start && TITLE_TRIM.indexOf(s.charAt(end - 1)) >= 0) end--;
            return s.substring(start, end);
        }
    }

    /** Priority and acceptance criteria found in a line range. */
    static final class Section {
        static final Section EMPTY = new Section(null, List.of());

        final String priority;
        final List<String> criteria;

        private Section(String priority, List<String> criteria) {
            this.priority = priority;
            this.criteria = criteria;
        }

        static Section read(List<String> lines, int from, int to) {
            String priority = null;
            List<String> criteria = new ArrayList<>();
            boolean labelSeen = false;
            boolean inFence = false;
            boolean fenceHoldsCriteria = false;

            for (int i = Math.max(0, from); i < Math.min(to, lines.size()); i++) {
                String line = lines.get(i);
                String trimmed = line.trim();

                if (inFence) {
                    if (StructuralMarkers.isFence(line)) {
                        inFence = false;
                    } else if (fenceHoldsCriteria && !trimmed.isEmpty() && !StructuralMarkers.isCommentLine(trimmed)) {
                        criteria.add(trimmed);
                    }
                    continue;
                }
                if (StructuralMarkers.isFence(line)) {
                    inFence = true;
                    fenceHoldsCriteria = labelSeen;
                    labelSeen = false;
                    continue;
                }
                if (StructuralMarkers.isAcceptanceCriteriaLabel(line)) {
                    labelSeen = true;
                    continue;
                }
                if (IdentifierGrammar.isHeading(line)) {
                    labelSeen = false;
                }

                if (priority == null) {
                    priority = StructuralMarkers.priorityBullet(line);
                }
                String obligation = StructuralMarkers.obligationBullet(line);
                if (obligation != null) {
                    criteria.add(obligation);
                }
            }
            return new Section(priority, List.copyOf(criteria));
        }
    }
}
