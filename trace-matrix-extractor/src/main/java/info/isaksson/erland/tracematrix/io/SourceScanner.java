package info.isaksson.erland.tracematrix.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic file discovery with ignore rules.
 *
 * <p>Ordering contract: files are returned sorted by their directory (relative to the root, '/' separated)
 * and then by file name. Callers fold results in this order, so "first encountered" is reproducible
 * across platforms and file systems.</p>
 *
 * <p>Ignore patterns are matched against {@code "/" + displayPath} where the display path is relative to the
 * root's parent (e.g. {@code /02-requirements/templates/x.md}). A pattern containing glob characters
 * ({@code * ? [}) is a glob; any other pattern is a plain substring.</p>
 */
public final class SourceScanner {

    private SourceScanner() {}

    /**
     * Scan for regular files under {@code root} accepted by {@code fileNameFilter}.
     *
     * @param root root folder to scan
     * @param fileNameFilter predicate on the bare file name
     * @param ignorePatterns substring fragments or globs of paths to skip
     */
    public static List<Path> scan(Path root, Predicate<String> fileNameFilter, List<String> ignorePatterns) throws IOException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(fileNameFilter, "fileNameFilter");

        final List<Predicate<String>> ignoreMatchers = compileIgnoreMatchers(ignorePatterns);

        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> fileNameFilter.test(p.getFileName().toString()))
                .filter(p -> !isInCommonBuildDir(root, p))
                .filter(p -> !matchesAny("/" + displayPath(root, p), ignoreMatchers))
                .forEach(out::add);

            out.sort(canonicalOrder(root));
            return out;
        }
    }

    /** (relative directory, file name) ordering. */
    public static Comparator<Path> canonicalOrder(Path root) {
        return Comparator
                .comparing((Path p) -> {
                    Path parent = root.relativize(p).getParent();
                    return parent == null ? "" : normalizePathString(parent);
                })
                .thenComparing(p -> p.getFileName().toString());
    }

    /**
     * Path used in reports and composite test ids: relative to the parent of {@code root}, so the root's own
     * name is kept ({@code tests/test_x.cpp}).
     */
    public static String displayPath(Path root, Path file) {
        Path base = root.toAbsolutePath().normalize().getParent();
        Path abs = file.toAbsolutePath().normalize();
        if (base == null) return normalizePathString(abs.getFileName());
        try {
            return normalizePathString(base.relativize(abs));
        } catch (IllegalArgumentException e) {
            return normalizePathString(abs);
        }
    }

    /**
     * Split a root list given as one string with {@code ;} or {@code ,} separators.
     */
    public static List<String> splitPathList(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String part : value.split("[;,]")) {
            String s = part.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static boolean matchesAny(String path, List<Predicate<String>> matchers) {
        if (matchers.isEmpty()) return false;
        for (Predicate<String> m : matchers) {
            if (m.test(path)) return true;
        }
        return false;
    }

    private static List<Predicate<String>> compileIgnoreMatchers(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<String>> out = new ArrayList<>();
        for (String raw : patterns) {
            if (raw == null) continue;
            String pattern = raw.trim();
            if (pattern.isEmpty()) continue;

            // Normalize to use forward slashes to be consistent across OSes.
            pattern = pattern.replace("\\", "/");

            if (pattern.contains("*") || pattern.contains("?") || pattern.contains("[")) {
                String glob = pattern.startsWith("/") || pattern.startsWith("**") ? pattern : "**/" + pattern;
                final var matcher = fs.getPathMatcher("glob:" + glob);
                out.add(p -> matcher.matches(Path.of(p)));
            } else {
                final String fragment = pattern;
                out.add(p -> p.contains(fragment));
            }
        }
        return out;
    }

    private static boolean isInCommonBuildDir(Path root, Path absolutePath) {
        String rel = normalizePathString(root.relativize(absolutePath));
        // Avoid scanning under build output folders by default.
        return rel.startsWith("target/")
                || rel.startsWith("build/")
                || rel.startsWith("out/")
                || rel.startsWith(".git/")
                || rel.startsWith(".idea/")
                || rel.startsWith(".gradle/")
                || rel.startsWith("node_modules/")
                || rel.contains("/node_modules/");
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
