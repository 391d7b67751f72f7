package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.extract.DocumentScanResult;
import info.isaksson.erland.tracematrix.extract.DocumentScanner;
import info.isaksson.erland.tracematrix.extract.TestAnnotationExtractor;
import info.isaksson.erland.tracematrix.extract.TestAnnotationScanResult;
import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.ResultSets;
import info.isaksson.erland.tracematrix.model.SpecIndex;
import info.isaksson.erland.tracematrix.results.ResultFileParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the whole pipeline: scan documents, index definitions, extract annotations, parse results, link and
 * aggregate.
 */
public final class TraceMatrixService {

    private static final Logger log = LoggerFactory.getLogger(TraceMatrixService.class);

    private final DocumentScanner documentScanner;
    private final TestAnnotationExtractor annotationExtractor;
    private final ResultFileParser resultParser;

    public TraceMatrixService() {
        this(new DocumentScanner(), new TestAnnotationExtractor(), new ResultFileParser());
    }

    public TraceMatrixService(DocumentScanner documentScanner,
                              TestAnnotationExtractor annotationExtractor,
                              ResultFileParser resultParser) {
        this.documentScanner = documentScanner;
        this.annotationExtractor = annotationExtractor;
        this.resultParser = resultParser;
    }

    public TraceMatrixResult generate(TraceMatrixOptions options) throws NoRequirementsFoundException {
        if (options == null) throw new IllegalArgumentException("options is required");
        if (options.requirementRoots == null || options.requirementRoots.isEmpty()) {
            throw new IllegalArgumentException("At least one requirements root is required");
        }
        List<String> warnings = new ArrayList<>();
        List<String> ignore = options.effectiveIgnorePatterns();

        DocumentScanResult docs = documentScanner.scan(options.requirementRoots, ignore);
        warnings.addAll(docs.warnings);

        RequirementCatalog catalog = DefinitionIndex.build(docs.documents);
        if (catalog.isEmpty()) {
            throw new NoRequirementsFoundException("No requirement definitions found under " + options.requirementRoots
                    + " (" + docs.documents.size() + " document(s) scanned)");
        }

        TestAnnotationScanResult tests = annotationExtractor.extract(
                options.testRoots == null ? List.of() : options.testRoots, options.testIgnorePatterns);
        warnings.addAll(tests.warnings);

        ResultSets results;
        if (options.resultsFile == null) {
            results = ResultSets.empty();
            warnings.add("No results file given; all tests are unresolved");
        } else {
            results = resultParser.parse(options.resultsFile, warnings);
        }
        log.debug("Parsed {} result(s) ({} passing, {} failing) as {}",
                results.size(), results.passing.size(), results.failing.size(), results.format);

        LinkResult linked = new ResultLinker(options.strictBoundaries).link(catalog, tests.annotations, results);

        CoverageReport report = new CoverageAggregator(options.priorities, options.categories, options.threshold)
                .aggregate(linked.catalog, linked.links, linked.unknownRequirementRefs, warnings);

        SpecIndex index = SpecIndexBuilder.build(catalog, docs.documents, ignore);

        return new TraceMatrixResult(docs.documents, catalog, tests.annotations, results, linked, report, index, warnings);
    }
}
