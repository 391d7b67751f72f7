package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.io.SourceScanner;
import info.isaksson.erland.tracematrix.model.ScannedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Walk requirement document roots and parse every recognized document.
 *
 * <p>Roots are visited in the given order, files within a root in (directory, file name) order. A file
 * that cannot be read or parsed is skipped with a warning; it never aborts the scan.</p>
 */
public final class DocumentScanner {

    private static final Logger log = LoggerFactory.getLogger(DocumentScanner.class);

    /** Instructional documents, templates and generator fixtures whose placeholder ids must not be indexed. */
    public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            ".github/copilot-instructions.md",
            "ADR-template.md",
            "user-story-template.md",
            "architecture-spec.md",
            "requirements-spec.md",
            "spec-kit-templates/",
            "/templates/",
            "REQUIREMENTS-ELICITATION-SESSION-",
            "functional/test-perfect-gen.md"
    );

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".md", ".markdown");

    private final RequirementDocumentParser parser = new RequirementDocumentParser();
    private final List<String> extensions;

    public DocumentScanner() {
        this(DEFAULT_EXTENSIONS);
    }

    public DocumentScanner(List<String> extensions) {
        this.extensions = extensions == null || extensions.isEmpty() ? DEFAULT_EXTENSIONS : List.copyOf(extensions);
    }

    public DocumentScanResult scan(List<Path> roots, List<String> ignorePatterns) {
        List<Path> files = new ArrayList<>();
        List<ScannedDocument> documents = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Path root : roots == null ? List.<Path>of() : roots) {
            if (root == null) continue;
            if (!Files.exists(root)) {
                warn(warnings, "Requirements path not found: " + root);
                continue;
            }
            if (Files.isRegularFile(root)) {
                // A single document given directly.
                files.add(root);
                parseInto(root, SourceScanner.displayPath(root.toAbsolutePath().getParent(), root), documents, warnings);
                continue;
            }

            List<Path> found;
            try {
                found = SourceScanner.scan(root, this::isDocument, ignorePatterns);
            } catch (IOException e) {
                warn(warnings, "Could not walk requirements root " + root + ": " + e.getMessage());
                continue;
            }
            for (Path file : found) {
                files.add(file);
                parseInto(file, SourceScanner.displayPath(root, file), documents, warnings);
            }
        }

        log.info("Scanned {} requirement document(s), {} skipped", files.size(), files.size() - documents.size());
        return new DocumentScanResult(files, documents, warnings);
    }

    boolean isDocument(String fileName) {
        if (fileName.startsWith("README")) return false;
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private void parseInto(Path file, String displayPath, List<ScannedDocument> documents, List<String> warnings) {
        try {
            ScannedDocument doc = parser.parse(file, displayPath);
            log.debug("{}: {} occurrence(s)", displayPath, doc.occurrences.size());
            documents.add(doc);
        } catch (DocumentParseException e) {
            warn(warnings, "Skipped " + e.getMessage());
        } catch (IOException e) {
            warn(warnings, "Skipped " + displayPath + ": could not read (" + e.getMessage() + ")");
        }
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
