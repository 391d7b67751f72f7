package info.isaksson.erland.tracematrix.results;

import info.isaksson.erland.tracematrix.io.TextFiles;
import info.isaksson.erland.tracematrix.model.ResultFormat;
import info.isaksson.erland.tracematrix.model.ResultSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parse a test results artifact into passing and failing test names.
 *
 * <p>Formats are tried in order and the first one yielding at least one result wins:</p>
 * <ol>
 *   <li>XML with one {@code Test} element per test ({@code Name} and {@code Status} as child elements or
 *   attributes); status {@code passed} (case-sensitive) passes, anything else fails</li>
 *   <li>{@code Test #<n>: <name> .... Passed|Failed|***Failed} lines</li>
 *   <li>{@code <i>/<n> Testing: <name>} blocks terminated by {@code Test Passed.} or {@code Test Failed.}</li>
 * </ol>
 *
 * <p>Bytes are decoded leniently (malformed UTF-8 is replaced). A name reported more than once keeps its
 * last outcome.</p>
 */
public final class ResultFileParser {

    private static final Logger log = LoggerFactory.getLogger(ResultFileParser.class);

    private static final Pattern LEGACY_LINE = Pattern.compile(
            "Test\\s+#\\d+:\\s+(\\S+)\\s+\\.+\\s*(Passed|\\*\\*\\*Failed|Failed)");

    private static final Pattern BLOCK_HEADER = Pattern.compile("^\\s*\\d+/\\d+\\s+Testing:\\s+(.+?)\\s*$");
    private static final Pattern BLOCK_TERMINAL = Pattern.compile("^\\s*Test (Passed|Failed)\\.\\s*$");

    /**
     * Parse {@code file}. A missing or unreadable file yields empty sets and a warning.
     *
     * @param warnings receives human readable warnings (may be null)
     */
    public ResultSets parse(Path file, List<String> warnings) {
        if (file == null) {
            warn(warnings, "No test results file given");
            return ResultSets.empty();
        }
        if (!Files.isRegularFile(file)) {
            warn(warnings, "Test results not found: " + file);
            return ResultSets.empty();
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            warn(warnings, "Could not read test results " + file + ": " + e.getMessage());
            return ResultSets.empty();
        }
        ResultSets res = parseText(TextFiles.decodeLossy(bytes));
        if (res.format == ResultFormat.NONE) {
            warn(warnings, "No test results recognized in " + file);
        } else {
            log.info("Parsed {} results from {}: {} passing, {} failing",
                    res.format, file, res.passing.size(), res.failing.size());
        }
        return res;
    }

    public ResultSets parseText(String text) {
        if (text == null || text.isBlank()) return ResultSets.empty();

        ResultSets xml = parseXml(text);
        if (xml != null && !xml.isEmpty()) return xml;

        ResultSets legacy = parseLegacyLog(text);
        if (!legacy.isEmpty()) return legacy;

        ResultSets block = parseBlockLog(text);
        if (!block.isEmpty()) return block;

        return ResultSets.empty();
    }

    /** Structured XML results, or null when {@code text} is not well-formed XML. */
    static ResultSets parseXml(String text) {
        String trimmed = text.stripLeading();
        if (!trimmed.startsWith("<")) return null;

        Document doc;
        try {
            doc = newBuilder().parse(new InputSource(new StringReader(trimmed)));
        } catch (SAXException | IOException e) {
            log.debug("Results are not XML: {}", e.getMessage());
            return null;
        }

        Accumulator acc = new Accumulator();
        NodeList tests = doc.getElementsByTagName("Test");
        for (int i = 0; i < tests.getLength(); i++) {
            Element test = (Element) tests.item(i);
            String name = valueOf(test, "Name", "name");
            String status = valueOf(test, "Status", "status");
            if (name == null || name.isEmpty() || status == null) continue;
            acc.record(name, "passed".equals(status));
        }
        return acc.toResultSets(ResultFormat.XML);
    }

    static ResultSets parseLegacyLog(String text) {
        Accumulator acc = new Accumulator();
        Matcher m = LEGACY_LINE.matcher(text);
        while (m.find()) {
            acc.record(m.group(1), "Passed".equals(m.group(2)));
        }
        return acc.toResultSets(ResultFormat.LEGACY_LOG);
    }

    static ResultSets parseBlockLog(String text) {
        Accumulator acc = new Accumulator();
        String current = null;
        for (String line : TextFiles.lines(text)) {
            Matcher header = BLOCK_HEADER.matcher(line);
            if (header.matches()) {
                current = header.group(1);
                continue;
            }
            if (current == null) continue;
            Matcher terminal = BLOCK_TERMINAL.matcher(line);
            if (terminal.matches()) {
                acc.record(current, "Passed".equals(terminal.group(1)));
                current = null;
            }
        }
        return acc.toResultSets(ResultFormat.BLOCK_LOG);
    }

    /** Child element text first, then attribute. */
    private static String valueOf(Element e, String... names) {
        for (String n : names) {
            for (Node c = e.getFirstChild(); c != null; c = c.getNextSibling()) {
                if (c.getNodeType() == Node.ELEMENT_NODE && n.equals(c.getNodeName())) {
                    String v = c.getTextContent();
                    return v == null ? "" : v.trim();
                }
            }
        }
        for (String n : names) {
            if (e.hasAttribute(n)) {
                return e.getAttribute(n).trim();
            }
        }
        return null;
    }

    private static DocumentBuilder newBuilder() throws SAXException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            // XXE protection
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new SilentErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new SAXException("XML parser not available", e);
        }
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        if (warnings != null) warnings.add(message);
    }

    /** Last outcome wins; a name is never in both sets. */
    private static final class Accumulator {
        final Set<String> passing = new LinkedHashSet<>();
        final Set<String> failing = new LinkedHashSet<>();

        void record(String name, boolean passed) {
            if (passed) {
                failing.remove(name);
                passing.add(name);
            } else {
                passing.remove(name);
                failing.add(name);
            }
        }

        ResultSets toResultSets(ResultFormat format) {
            if (passing.isEmpty() && failing.isEmpty()) return ResultSets.empty();
            return new ResultSets(format, passing, failing);
        }
    }

    /** Keeps the JDK parser from printing "[Fatal Error]" lines; errors still surface as exceptions. */
    private static final class SilentErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning: {}", e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
