package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.extract.DocumentScanner;
import info.isaksson.erland.tracematrix.model.IdentifierCategory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Options for one trace matrix run.
 */
public final class TraceMatrixOptions {
    public List<Path> requirementRoots = new ArrayList<>();
    public List<Path> testRoots = new ArrayList<>();
    /** Result file; null means no results (every test stays unresolved). */
    public Path resultsFile;

    /** When false, {@link DocumentScanner#DEFAULT_IGNORE_PATTERNS} are not applied. */
    public boolean useDefaultIgnores = true;
    /** Extra ignore patterns for requirement documents (substring, or glob when it contains {@code * ? [}). */
    public List<String> ignorePatterns = new ArrayList<>();
    /** Ignore patterns for test sources. */
    public List<String> testIgnorePatterns = new ArrayList<>();

    public Set<String> priorities = new LinkedHashSet<>(CoverageAggregator.DEFAULT_PRIORITIES);
    /** Empty means all categories. */
    public Set<IdentifierCategory> categories = new LinkedHashSet<>();
    public double threshold = CoverageAggregator.DEFAULT_THRESHOLD;
    public boolean strictBoundaries = false;

    /** Ignore patterns actually applied to requirement documents. */
    public List<String> effectiveIgnorePatterns() {
        List<String> out = new ArrayList<>();
        if (useDefaultIgnores) out.addAll(DocumentScanner.DEFAULT_IGNORE_PATTERNS);
        for (String p : ignorePatterns) {
            if (p != null && !p.isBlank() && !out.contains(p)) out.add(p);
        }
        return out;
    }
}
