package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.grammar.StructuralMarkers;
import info.isaksson.erland.tracematrix.io.SourceScanner;
import info.isaksson.erland.tracematrix.io.TextFiles;
import info.isaksson.erland.tracematrix.model.Identifier;
import info.isaksson.erland.tracematrix.model.TestAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extract {@code @satisfies} annotations from test sources and tie them to test declarations.
 *
 * <p>Each file is scanned line by line with a pending list of identifiers. An annotation appends to the list;
 * a test declaration ({@link TestDeclarationIdiom}) takes the pending list, if any, and clears it. Marker idioms
 * ({@code @Test}, {@code #[test]}) arm on their marker and declare on the next function line. A file that
 * carries annotations but no recognized declaration attributes all of them to one file-level test named after
 * the file (without its {@code test_} prefix).</p>
 */
public final class TestAnnotationExtractor {

    private static final Logger log = LoggerFactory.getLogger(TestAnnotationExtractor.class);

    public static final List<String> SOURCE_EXTENSIONS = List.of(
            ".c", ".cc", ".cpp", ".cxx", ".h", ".hpp", ".py", ".java", ".kt", ".js", ".ts", ".go", ".rs");

    public TestAnnotationScanResult extract(List<Path> roots, List<String> ignorePatterns) {
        List<Path> files = new ArrayList<>();
        List<TestAnnotation> annotations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Path root : roots == null ? List.<Path>of() : roots) {
            if (root == null) continue;
            if (!Files.isDirectory(root)) {
                warn(warnings, "Test directory not found: " + root);
                continue;
            }
            List<Path> found;
            try {
                found = SourceScanner.scan(root, TestAnnotationExtractor::isTestSource, ignorePatterns);
            } catch (IOException e) {
                warn(warnings, "Could not walk test root " + root + ": " + e.getMessage());
                continue;
            }
            for (Path file : found) {
                files.add(file);
                String display = SourceScanner.displayPath(root, file);
                try {
                    List<String> lines = TextFiles.lines(TextFiles.readLossy(file));
                    annotations.addAll(extractFile(display, file.getFileName().toString(), lines));
                } catch (IOException e) {
                    warn(warnings, "Skipped " + display + ": could not read (" + e.getMessage() + ")");
                }
            }
        }

        log.info("Found {} annotated test(s) in {} test source file(s)", annotations.size(), files.size());
        return new TestAnnotationScanResult(files, annotations, warnings);
    }

    /**
     * Annotations of one file.
     *
     * @param displayPath path used as the first part of composite test ids
     * @param fileName bare file name, used for the file-level fallback
     */
    public List<TestAnnotation> extractFile(String displayPath, String fileName, List<String> lines) {
        Map<String, Set<String>> byTest = new LinkedHashMap<>();
        Set<String> allInFile = new LinkedHashSet<>();
        List<String> pending = new ArrayList<>();
        boolean anyDeclaration = false;
        TestDeclarationIdiom armed = null;

        for (String line : lines) {
            for (Identifier id : StructuralMarkers.satisfies(line)) {
                pending.add(id.value);
                allInFile.add(id.value);
            }

            String testName = TestDeclarationIdiom.match(line);
            if (testName == null) {
                TestDeclarationIdiom marked = TestDeclarationIdiom.markedBy(line);
                if (marked != null) armed = marked;
                if (armed != null) testName = armed.testName(line);
            }
            if (testName == null) continue;
            armed = null;
            anyDeclaration = true;
            if (!pending.isEmpty()) {
                byTest.computeIfAbsent(TestAnnotation.testId(displayPath, testName), k -> new LinkedHashSet<>())
                        .addAll(pending);
                pending.clear();
            }
        }

        List<TestAnnotation> out = new ArrayList<>();
        if (!anyDeclaration) {
            if (!allInFile.isEmpty()) {
                String testId = TestAnnotation.testId(displayPath, fileLevelName(fileName));
                out.add(new TestAnnotation(testId, new ArrayList<>(allInFile), true));
            }
            return out;
        }
        if (!pending.isEmpty()) {
            log.debug("{}: {} annotation(s) after the last test declaration are not attributed", displayPath, pending.size());
        }
        for (Map.Entry<String, Set<String>> e : byTest.entrySet()) {
            out.add(new TestAnnotation(e.getKey(), new ArrayList<>(e.getValue()), false));
        }
        return out;
    }

    /** File stem without a conventional {@code test_} / {@code test-} prefix. */
    static String fileLevelName(String fileName) {
        String stem = TextFiles.stem(fileName);
        String lower = stem.toLowerCase(Locale.ROOT);
        if ((lower.startsWith("test_") || lower.startsWith("test-")) && stem.length() > 5) {
            return stem.substring(5);
        }
        return stem;
    }

    /**
     * {@code test_*} files, or stems ending in {@code _test}, {@code Test}, {@code Tests}, {@code .test} or
     * {@code .spec}, with a source extension.
     */
    static boolean isTestSource(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        boolean sourceExt = false;
        for (String ext : SOURCE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                sourceExt = true;
                break;
            }
        }
        if (!sourceExt) return false;
        String stem = TextFiles.stem(fileName);
        return lower.startsWith("test_")
                || stem.endsWith("_test")
                || stem.endsWith("Test")
                || stem.endsWith("Tests")
                || stem.endsWith(".test")
                || stem.endsWith(".spec");
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
