package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.ResultSets;
import info.isaksson.erland.tracematrix.model.ScannedDocument;
import info.isaksson.erland.tracematrix.model.SpecIndex;
import info.isaksson.erland.tracematrix.model.TestAnnotation;

import java.util.List;

public final class TraceMatrixResult {
    public final List<ScannedDocument> documents;
    /** Catalog as built from the documents, before linking. */
    public final RequirementCatalog catalog;
    public final List<TestAnnotation> annotations;
    public final ResultSets results;
    /** Catalog with test links applied. */
    public final LinkResult linked;
    public final CoverageReport report;
    public final SpecIndex specIndex;
    public final List<String> warnings;

    public TraceMatrixResult(List<ScannedDocument> documents,
                             RequirementCatalog catalog,
                             List<TestAnnotation> annotations,
                             ResultSets results,
                             LinkResult linked,
                             CoverageReport report,
                             SpecIndex specIndex,
                             List<String> warnings) {
        this.documents = documents == null ? List.of() : List.copyOf(documents);
        this.catalog = catalog;
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.results = results == null ? ResultSets.empty() : results;
        this.linked = linked;
        this.report = report;
        this.specIndex = specIndex;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
