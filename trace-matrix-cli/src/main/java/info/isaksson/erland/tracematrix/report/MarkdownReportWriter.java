package info.isaksson.erland.tracematrix.report;

import info.isaksson.erland.tracematrix.model.CoverageReport;
import info.isaksson.erland.tracematrix.model.DuplicateDefinition;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementStatus;
import info.isaksson.erland.tracematrix.model.TestLink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable markdown traceability report.
 *
 * The output contains no timestamps so that two runs over the same inputs produce identical files.
 */
public final class MarkdownReportWriter {

    private MarkdownReportWriter() {}

    public static void writeMarkdown(Path reportPath, CoverageReport report, List<Path> requirementRoots,
                                     List<Path> testRoots, Path resultsFile) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, render(report, requirementRoots, testRoots, resultsFile));
    }

    public static String render(CoverageReport report, List<Path> requirementRoots, List<Path> testRoots, Path resultsFile) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Requirements traceability report\n\n");

        sb.append("## Summary\n\n");
        sb.append("- Requirements: ").append(paths(requirementRoots)).append("\n");
        sb.append("- Tests: ").append(paths(testRoots)).append("\n");
        sb.append("- Results: ").append(resultsFile == null ? "_(none)_" : "`" + resultsFile + "`").append("\n");
        sb.append("- Priorities: `").append(String.join("`, `", report.priorities)).append("`\n");
        sb.append("- Categories: ").append(report.categories.isEmpty()
                ? "_(all)_" : "`" + String.join("`, `", report.categories) + "`").append("\n");
        sb.append("- Requirements in scope: **").append(report.totalRequirements).append("**\n");
        sb.append("- Requirements with passing tests: **").append(report.testedRequirements).append("**\n");
        sb.append("- Requirements without passing tests: **")
                .append(report.totalRequirements - report.testedRequirements).append("**\n");
        sb.append("- Coverage: **").append(pct(report.coverage)).append("%** (threshold ")
                .append(pct(report.threshold)).append("%) ")
                .append(report.meetsThreshold ? "PASS" : "FAIL").append("\n\n");

        sb.append("## Status breakdown\n\n");
        sb.append("| Status | Count | Percentage |\n");
        sb.append("|---|---:|---:|\n");
        for (Map.Entry<RequirementStatus, Integer> e : report.statusCounts.entrySet()) {
            double share = report.totalRequirements == 0 ? 0.0 : e.getValue() * 100.0 / report.totalRequirements;
            sb.append("| ").append(e.getKey().label()).append(" | ").append(e.getValue())
                    .append(" | ").append(pct(share)).append("% |\n");
        }

        Map<String, TestLink> linksById = new LinkedHashMap<>();
        for (TestLink l : report.links) linksById.putIfAbsent(l.testId, l);

        sb.append("\n## Requirements detail\n\n");
        if (report.requirements.isEmpty()) {
            sb.append("_(none)_\n\n");
        }
        for (Requirement r : report.requirements) {
            sb.append("### ").append(r.id.value);
            if (!r.title.isEmpty()) sb.append(": ").append(r.title);
            sb.append(" (").append(r.priority).append(")\n\n");
            sb.append("- Source: `").append(r.sourcePath).append("`\n");
            if (!r.references.isEmpty()) {
                sb.append("- References: ").append(String.join(", ", r.references)).append("\n");
            }
            sb.append("\n**Acceptance criteria**:\n\n");
            if (r.acceptanceCriteria.isEmpty()) {
                sb.append("_(none)_\n");
            } else {
                for (String c : r.acceptanceCriteria) sb.append("- ").append(c).append("\n");
            }

            sb.append("\n**Linked tests**: ").append(r.testCases.size()).append(" (")
                    .append(r.passingTests.size()).append(" passing, ")
                    .append(r.failingTests.size()).append(" failing)\n\n");
            sb.append("| Test | Status | Match | Result |\n");
            sb.append("|---|---|---|---|\n");
            if (r.testCases.isEmpty()) {
                sb.append("| _(no tests)_ | - | - | - |\n");
            } else {
                List<String> sorted = new ArrayList<>(r.testCases);
                sorted.sort(null);
                for (String testId : sorted) {
                    TestLink link = linksById.get(testId);
                    String status = r.passingTests.contains(testId) ? "passed"
                            : r.failingTests.contains(testId) ? "failed" : "unknown";
                    sb.append("| `").append(testId).append("` | ").append(status).append(" | ")
                            .append(link == null ? "-" : link.confidence.name().toLowerCase(Locale.ROOT)).append(" | ")
                            .append(link == null || link.matchedResult == null ? "-" : "`" + link.matchedResult + "`")
                            .append(" |\n");
                }
            }
            sb.append("\n- Coverage: ").append(String.format(Locale.ROOT, "%.0f", r.coverage())).append("%\n");
            sb.append("- Status: ").append(r.status().label()).append("\n\n---\n\n");
        }

        sb.append("## Requirements needing attention\n\n");
        if (report.needingAttention.isEmpty()) {
            sb.append("_(none)_\n");
        } else {
            int i = 1;
            for (String id : report.needingAttention) {
                Requirement r = report.requirement(id);
                sb.append(i++).append(". **").append(id).append("** (").append(r.priority).append(")");
                if (!r.title.isEmpty()) sb.append(": ").append(r.title);
                sb.append("\n");
            }
        }

        sb.append("\n## Duplicate definitions\n\n");
        if (report.duplicateDefinitions.isEmpty()) {
            sb.append("_(none)_\n");
        } else {
            for (DuplicateDefinition d : report.duplicateDefinitions) {
                sb.append("- `").append(d.id).append("`: ").append(d.extraDefinitions)
                        .append(" extra definition(s) in ");
                sb.append(d.paths.stream().map(p -> "`" + p + "`").reduce((a, b) -> a + ", " + b).orElse(""));
                sb.append("\n");
            }
        }

        sb.append("\n## Orphan references\n\n");
        if (report.orphanReferences.isEmpty()) {
            sb.append("_(none)_\n");
        } else {
            for (Map.Entry<String, String> e : report.orphanReferences.entrySet()) {
                sb.append("- `").append(e.getKey()).append("` (first seen in `").append(e.getValue()).append("`)\n");
            }
        }

        sb.append("\n## Unknown requirement references\n\n");
        if (report.unknownRequirementRefs.isEmpty()) {
            sb.append("_(none)_\n");
        } else {
            for (String id : report.unknownRequirementRefs) sb.append("- `").append(id).append("`\n");
        }

        sb.append("\n## Warnings\n\n");
        if (report.warnings.isEmpty()) {
            sb.append("_(none)_\n");
        } else {
            for (String w : report.warnings) sb.append("- ").append(w).append("\n");
        }
        return sb.toString();
    }

    private static String paths(List<Path> paths) {
        if (paths == null || paths.isEmpty()) return "_(none)_";
        List<String> out = new ArrayList<>();
        for (Path p : paths) out.add("`" + p + "`");
        return String.join(", ", out);
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
