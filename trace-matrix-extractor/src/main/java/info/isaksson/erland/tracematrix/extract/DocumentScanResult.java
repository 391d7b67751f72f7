package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.model.ScannedDocument;

import java.nio.file.Path;
import java.util.List;

/** Documents parsed by {@link DocumentScanner}, in canonical order, plus files skipped with a warning. */
public final class DocumentScanResult {
    public final List<Path> files;
    public final List<ScannedDocument> documents;
    public final List<String> warnings;

    public DocumentScanResult(List<Path> files, List<ScannedDocument> documents, List<String> warnings) {
        this.files = files == null ? List.of() : List.copyOf(files);
        this.documents = documents == null ? List.of() : List.copyOf(documents);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
