package info.isaksson.erland.tracematrix.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Supported ways of declaring a test in source. The first idiom matching a line wins.
 *
 * <p>Some idioms declare a test with a marker ({@code @Test}, {@code #[test]}) on the line before the function
 * or on the same line. Those only match a function line once their marker has been seen; see
 * {@link TestAnnotationExtractor}.</p>
 */
public enum TestDeclarationIdiom {
    /** Catch2 {@code TEST_CASE("name", "[tag]")} / {@code SCENARIO("name", "[tag]")}: name {@code name::tag}. */
    CATCH2_TAGGED("\\b(?:TEST_CASE|SCENARIO)\\(\\s*\"([^\"]+)\"\\s*,\\s*\"\\[([^\"]*)\\]\"\\s*\\)", null, true),
    /** Catch2 without tags. */
    CATCH2("\\b(?:TEST_CASE|SCENARIO)\\(\\s*\"([^\"]+)\"\\s*\\)", null, false),
    /** GoogleTest {@code TEST(Suite, Name)}, {@code TEST_F}, {@code TEST_P}: name {@code Suite::Name}. */
    GOOGLE_TEST("\\bTEST(?:_F|_P)?\\(\\s*(\\w+)\\s*,\\s*(\\w+)\\s*\\)", null, true),
    /** Plain C/C++/Java style {@code void test_x(}. */
    PLAIN_FUNCTION("\\bvoid\\s+(test_\\w+)\\s*\\(", null, false),
    /** Python {@code def test_x(}. */
    PYTHON_FUNCTION("^\\s*(?:async\\s+)?def\\s+(test_\\w+)\\s*\\(", null, false),
    /** Go {@code func TestX(t *testing.T)}. */
    GO_TEST("^\\s*func\\s+(Test\\w*)\\s*\\(", null, false),
    /** Jest/Mocha {@code it("name", ...)} / {@code test("name", ...)}, including {@code .only} and {@code .skip}. */
    JS_TEST("(?<![\\w.$])(?:it|test)(?:\\.only|\\.skip)?\\(\\s*(?:'([^']+)'|\"([^\"]+)\"|`([^`]+)`)", null, false),
    /** JUnit / Kotlin test functions after {@code @Test}, {@code @ParameterizedTest} or {@code @RepeatedTest}. */
    JUNIT("\\b(?:void|fun)\\s+(\\w+|`[^`]+`)\\s*\\(",
            "(?:^|\\s)@(?:org\\.junit\\.(?:jupiter\\.api\\.)?)?(?:Test|ParameterizedTest|RepeatedTest)\\b", false),
    /** Rust functions after {@code #[test]} or an async runtime's {@code #[tokio::test]}. */
    RUST_TEST("\\bfn\\s+(\\w+)\\s*[(<]", "^\\s*#\\[(?:\\w+::)*test(?:\\([^)]*\\))?\\]", false);

    private final Pattern pattern;
    private final Pattern marker;
    private final boolean qualified;

    TestDeclarationIdiom(String regex, String markerRegex, boolean qualified) {
        this.pattern = Pattern.compile(regex);
        this.marker = markerRegex == null ? null : Pattern.compile(markerRegex);
        this.qualified = qualified;
    }

    /** True when this idiom only declares a test after its marker. */
    public boolean needsMarker() {
        return marker != null;
    }

    /** True when {@code line} carries this idiom's marker. */
    public boolean isMarker(String line) {
        return marker != null && line != null && marker.matcher(line).find();
    }

    /** In-file test name declared on {@code line}, or null when this idiom does not match. */
    public String testName(String line) {
        if (line == null) return null;
        Matcher m = pattern.matcher(line);
        if (!m.find()) return null;
        if (qualified) {
            return m.group(1).trim() + "::" + m.group(2).trim();
        }
        for (int g = 1; g <= m.groupCount(); g++) {
            String name = m.group(g);
            if (name != null) return stripBackticks(name.trim());
        }
        return null;
    }

    /** Test name declared on {@code line} by any idiom that needs no marker, or null. */
    public static String match(String line) {
        for (TestDeclarationIdiom idiom : values()) {
            if (idiom.needsMarker()) continue;
            String name = idiom.testName(line);
            if (name != null) return name;
        }
        return null;
    }

    /** The idiom whose marker is on {@code line}, or null. */
    public static TestDeclarationIdiom markedBy(String line) {
        for (TestDeclarationIdiom idiom : values()) {
            if (idiom.isMarker(line)) return idiom;
        }
        return null;
    }

    private static String stripBackticks(String name) {
        if (name.length() >= 2 && name.startsWith("`") && name.endsWith("`")) {
            return name.substring(1, name.length() - 1).trim();
        }
        return name;
    }
}
