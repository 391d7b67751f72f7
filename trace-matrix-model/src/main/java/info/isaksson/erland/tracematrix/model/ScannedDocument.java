package info.isaksson.erland.tracematrix.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Everything extracted from one requirement document, in line order. */
public final class ScannedDocument {
    /** Path relative to the scanned root, '/' separated. */
    public final String path;
    /** First 8 hex chars of the SHA-1 of the document text. */
    public final String contentHash;
    public final Map<String, String> frontMatter;
    public final List<Occurrence> occurrences;

    public ScannedDocument(String path, String contentHash, Map<String, String> frontMatter, List<Occurrence> occurrences) {
        this.path = Objects.requireNonNull(path, "path");
        this.contentHash = contentHash == null ? "" : contentHash;
        this.frontMatter = frontMatter == null ? Map.of() : Map.copyOf(frontMatter);
        this.occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }
}
