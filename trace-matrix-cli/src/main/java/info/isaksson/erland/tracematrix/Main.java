package info.isaksson.erland.tracematrix;

import info.isaksson.erland.tracematrix.core.CoverageAggregator;
import info.isaksson.erland.tracematrix.core.NoRequirementsFoundException;
import info.isaksson.erland.tracematrix.core.TraceMatrixOptions;
import info.isaksson.erland.tracematrix.core.TraceMatrixResult;
import info.isaksson.erland.tracematrix.core.TraceMatrixService;
import info.isaksson.erland.tracematrix.io.SourceScanner;
import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.IdentifierCategory;
import info.isaksson.erland.tracematrix.model.TraceJson;
import info.isaksson.erland.tracematrix.report.MarkdownReportWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CLI entrypoint: scan requirement documents and annotated tests, match test results and write the
 * traceability report.
 */
public final class Main {

    private static final TraceMatrixService SERVICE = new TraceMatrixService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.requirements.isEmpty()) {
            System.err.println("Error: --requirements is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        TraceMatrixOptions opts = toCoreOptions(parsed);
        final Path reportOut = Paths.get(parsed.output).toAbsolutePath().normalize();

        final TraceMatrixResult res;
        try {
            res = SERVICE.generate(opts);
        } catch (NoRequirementsFoundException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            System.err.println("Error: trace matrix generation failed.");
            System.err.println(e.getMessage());
            return 2;
        }
        CoverageReport report = res.report;

        try {
            MarkdownReportWriter.writeMarkdown(reportOut, report, opts.requirementRoots, opts.testRoots, opts.resultsFile);
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.writeIndex != null) {
            Path indexOut = Paths.get(parsed.writeIndex).toAbsolutePath().normalize();
            try {
                TraceJson.write(res.specIndex, indexOut);
            } catch (IOException e) {
                System.err.println("Error: could not write spec index to: " + indexOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        if (parsed.writeJson != null) {
            Path jsonOut = Paths.get(parsed.writeJson).toAbsolutePath().normalize();
            try {
                TraceJson.write(report, jsonOut);
            } catch (IOException e) {
                System.err.println("Error: could not write trace JSON to: " + jsonOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "trace-matrix\n" +
                "- Report: " + reportOut + "\n" +
                "- Documents: " + res.documents.size() + "\n" +
                "- Requirements in scope: " + report.totalRequirements + "\n" +
                "- Annotated tests: " + res.annotations.size() + "\n" +
                "- Results: " + res.results.size() + " (" + res.results.format + ")\n" +
                "- Coverage: " + String.format(Locale.ROOT, "%.1f", report.coverage) + "% (threshold "
                        + String.format(Locale.ROOT, "%.1f", report.threshold) + "%) "
                        + (report.meetsThreshold ? "PASS" : "FAIL") + "\n" +
                "- Warnings: " + report.warnings.size()
        );

        if (parsed.failUnderThreshold && !report.meetsThreshold) {
            System.err.println("Coverage below threshold and --fail-under-threshold is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }
        return 0;
    }

    private static TraceMatrixOptions toCoreOptions(CliArgs parsed) {
        TraceMatrixOptions o = new TraceMatrixOptions();
        o.requirementRoots = toPaths(parsed.requirements);
        o.testRoots = toPaths(parsed.tests);
        o.resultsFile = parsed.results == null ? null : Paths.get(parsed.results).toAbsolutePath().normalize();
        o.useDefaultIgnores = !parsed.noDefaultIgnores;
        o.ignorePatterns = new ArrayList<>(parsed.ignores);
        o.testIgnorePatterns = new ArrayList<>(parsed.testIgnores);
        o.threshold = parsed.threshold;
        if (!parsed.priorities.isEmpty()) o.priorities = new LinkedHashSet<>(parsed.priorities);
        o.categories = new LinkedHashSet<>(parsed.categories);
        o.strictBoundaries = parsed.strictMatch;
        return o;
    }

    private static List<Path> toPaths(List<String> values) {
        List<Path> out = new ArrayList<>();
        for (String v : values) out.add(Paths.get(v).toAbsolutePath().normalize());
        return out;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        final List<String> requirements = new ArrayList<>();
        final List<String> tests = new ArrayList<>();
        String results;
        String output = "./traceability-report.md";
        String writeIndex;
        String writeJson;

        double threshold = CoverageAggregator.DEFAULT_THRESHOLD;
        final List<String> priorities = new ArrayList<>();
        final Set<IdentifierCategory> categories = new LinkedHashSet<>();

        final List<String> ignores = new ArrayList<>();
        final List<String> testIgnores = new ArrayList<>();
        boolean noDefaultIgnores = false;
        boolean strictMatch = false;
        boolean failUnderThreshold = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --ignore=fragment and --test-ignore=fragment
                if (a.startsWith("--ignore=")) {
                    out.ignores.add(a.substring("--ignore=".length()));
                    continue;
                }
                if (a.startsWith("--test-ignore=")) {
                    out.testIgnores.add(a.substring("--test-ignore=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--requirements":
                        out.requirements.addAll(SourceScanner.splitPathList(requireValue(args, ++i, "--requirements")));
                        break;
                    case "--tests":
                        out.tests.addAll(SourceScanner.splitPathList(requireValue(args, ++i, "--tests")));
                        break;
                    case "--results":
                        out.results = requireValue(args, ++i, "--results");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--write-index":
                        out.writeIndex = requireValue(args, ++i, "--write-index");
                        break;
                    case "--write-json":
                        out.writeJson = requireValue(args, ++i, "--write-json");
                        break;
                    case "--threshold":
                        out.threshold = parseThreshold(requireValue(args, ++i, "--threshold"));
                        break;
                    case "--priorities":
                        out.priorities.addAll(parsePriorities(requireValue(args, ++i, "--priorities")));
                        break;
                    case "--categories":
                        for (String c : requireValue(args, ++i, "--categories").split(",")) {
                            out.categories.add(IdentifierCategory.parseCli(c));
                        }
                        break;
                    case "--ignore":
                        out.ignores.add(requireValue(args, ++i, "--ignore"));
                        break;
                    case "--test-ignore":
                        out.testIgnores.add(requireValue(args, ++i, "--test-ignore"));
                        break;
                    case "--no-default-ignores":
                        out.noDefaultIgnores = true;
                        break;
                    case "--strict-match":
                        out.strictMatch = true;
                        break;
                    case "--fail-under-threshold":
                        out.failUnderThreshold = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        throw new IllegalArgumentException("Unexpected extra argument: " + a);
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static double parseThreshold(String v) {
            final double d;
            try {
                d = Double.parseDouble(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for --threshold: " + v);
            }
            if (Double.isNaN(d) || d < 0.0 || d > 100.0) {
                throw new IllegalArgumentException("--threshold must be between 0 and 100: " + v);
            }
            return d;
        }

        static List<String> parsePriorities(String v) {
            List<String> out = new ArrayList<>();
            for (String p : v.split(",")) {
                String s = p.trim().toUpperCase(Locale.ROOT);
                if (s.isEmpty()) continue;
                if (!s.matches("P\\d+")) {
                    throw new IllegalArgumentException("Invalid priority for --priorities: " + p.trim());
                }
                out.add(s);
            }
            return out;
        }

        static void printHelp() {
            System.out.println(
                    "trace-matrix\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar trace-matrix.jar --requirements <paths> --tests <paths> --results <file> [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --requirements <paths>  Requirement documents: directories or markdown files,\n" +
                    "                          separated by ';' or ',' (required)\n" +
                    "  --tests <paths>         Test source directories, separated by ';' or ','\n" +
                    "  --results <file>        Test results: CTest XML, CTest log or block log\n" +
                    "  --output <file>         Markdown report (default: ./traceability-report.md)\n" +
                    "  --write-index <file>    Also write the spec index JSON\n" +
                    "  --write-json <file>     Also write the full report model as JSON\n" +
                    "  --threshold <percent>   Minimum requirement coverage (default: 75)\n" +
                    "  --priorities <list>     Priorities in scope, e.g. P0,P1 (default: P0,P1)\n" +
                    "  --categories <list>     Identifier categories in scope, e.g. StR,REQ (default: all)\n" +
                    "  --ignore <fragment>     Skip requirement documents whose path contains the fragment or\n" +
                    "                          matches the glob (repeatable). Also supports --ignore=<fragment>.\n" +
                    "  --test-ignore <fragment>\n" +
                    "                          Skip test sources whose path contains the fragment or matches\n" +
                    "                          the glob (repeatable). Also supports --test-ignore=<fragment>.\n" +
                    "  --no-default-ignores    Do not apply the built-in ignore patterns\n" +
                    "  --strict-match          Exact test/result matches must fall on word boundaries\n" +
                    "  --fail-under-threshold  Exit with code 3 when coverage is below the threshold\n" +
                    "  -h, --help              Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 usage error, 2 no requirements found or output error, 3 below threshold.\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/trace-matrix.jar --requirements docs/requirements --tests tests \\\n" +
                    "      --results build/Testing/Temporary/LastTest.log --output reports/traceability.md\n"
            );
        }
    }
}
