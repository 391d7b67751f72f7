package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.model.TestAnnotation;

import java.nio.file.Path;
import java.util.List;

/** Annotations found in test sources, in canonical file order. */
public final class TestAnnotationScanResult {
    public final List<Path> files;
    public final List<TestAnnotation> annotations;
    public final List<String> warnings;

    public TestAnnotationScanResult(List<Path> files, List<TestAnnotation> annotations, List<String> warnings) {
        this.files = files == null ? List.of() : List.copyOf(files);
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
