package info.isaksson.erland.tracematrix.extract;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Front matter block: a first line {@code ---}, a YAML mapping, a closing {@code ---} line.
 *
 * <p>{@link #values} holds one string per top-level key: scalars as written, sequences joined with
 * {@code ", "}. {@link #texts} holds every scalar found under a key, nested ones included, so identifiers
 * in lists and sub-mappings can be located.</p>
 */
public final class FrontMatter {
    public static final String DELIMITER = "---";

    private static final Pattern TOP_LEVEL_KEY = Pattern.compile("^(['\"]?)([^\\s#:'\"][^:]*?)\\1\\s*:(?:\\s|$)");

    public final Map<String, String> values;
    /** Every scalar under each top-level key, in document order. */
    public final Map<String, List<String>> texts;
    /** Index of the first line after the block (0 when there is no front matter). */
    public final int bodyStart;
    /** Line index (0-based) of each top-level key, for locating references. */
    public final Map<String, Integer> keyLines;

    private FrontMatter(Map<String, String> values, Map<String, List<String>> texts,
                        Map<String, Integer> keyLines, int bodyStart) {
        this.values = Collections.unmodifiableMap(values);
        this.texts = Collections.unmodifiableMap(texts);
        this.keyLines = Collections.unmodifiableMap(keyLines);
        this.bodyStart = bodyStart;
    }

    public static FrontMatter empty() {
        return new FrontMatter(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), 0);
    }

    /**
     * Parse the front matter at the top of {@code lines}.
     *
     * @throws DocumentParseException when the opening delimiter is not closed, the block is not valid YAML,
     *                                or it is not a mapping
     */
    public static FrontMatter parse(String path, List<String> lines) throws DocumentParseException {
        if (lines.isEmpty() || !DELIMITER.equals(lines.get(0).trim())) {
            return empty();
        }
        int close = -1;
        for (int i = 1; i < lines.size(); i++) {
            if (DELIMITER.equals(lines.get(i).trim())) {
                close = i;
                break;
            }
        }
        if (close < 0) {
            throw new DocumentParseException(path, "front matter opened on line 1 is never closed");
        }

        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(String.join("\n", lines.subList(1, close)));
        } catch (YAMLException e) {
            throw new DocumentParseException(path, "front matter is not valid YAML: " + firstLine(e.getMessage()), e);
        }
        if (root == null) {
            return new FrontMatter(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), close + 1);
        }
        if (!(root instanceof Map)) {
            throw new DocumentParseException(path, "front matter is not a key/value mapping");
        }

        Map<String, String> values = new LinkedHashMap<>();
        Map<String, List<String>> texts = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) root).entrySet()) {
            String key = scalar(e.getKey());
            List<String> collected = new ArrayList<>();
            collect(e.getValue(), collected);
            values.put(key, flatten(e.getValue()));
            texts.put(key, List.copyOf(collected));
        }

        Map<String, Integer> keyLines = new LinkedHashMap<>();
        for (int i = 1; i < close; i++) {
            Matcher m = TOP_LEVEL_KEY.matcher(lines.get(i));
            if (m.find()) {
                String key = m.group(2).trim();
                if (values.containsKey(key)) keyLines.putIfAbsent(key, i);
            }
        }
        return new FrontMatter(values, texts, keyLines, close + 1);
    }

    public String get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty() && bodyStart == 0;
    }

    private static String flatten(Object value) {
        if (value instanceof Collection) {
            List<String> parts = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                parts.add(flatten(item));
            }
            return String.join(", ", parts);
        }
        if (value instanceof Map) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                parts.add(scalar(e.getKey()) + ": " + flatten(e.getValue()));
            }
            return String.join(", ", parts);
        }
        return scalar(value);
    }

    private static void collect(Object value, List<String> out) {
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) collect(item, out);
        } else if (value instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                out.add(scalar(e.getKey()));
                collect(e.getValue(), out);
            }
        } else if (value != null) {
            out.add(scalar(value));
        }
    }

    private static String scalar(Object value) {
        if (value == null) return "";
        if (value instanceof Date) {
            ZonedDateTime utc = ((Date) value).toInstant().atZone(ZoneOffset.UTC);
            return utc.toLocalTime().equals(LocalTime.MIDNIGHT) ? utc.toLocalDate().toString() : utc.toInstant().toString();
        }
        return String.valueOf(value).trim();
    }

    private static String firstLine(String message) {
        if (message == null) return "parse error";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
