package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.model.MatchConfidence;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.ResultSets;
import info.isaksson.erland.tracematrix.model.TestAnnotation;
import info.isaksson.erland.tracematrix.model.TestLink;
import info.isaksson.erland.tracematrix.model.TestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tie annotated tests to parsed results and record the links on the requirements they satisfy.
 *
 * <p>Matching works on the short test name (the composite id without its file path):</p>
 * <ol>
 *   <li>exact: a result name containing the short name. Passing wins when both sets contain one.</li>
 *   <li>heuristic, only when nothing matched exactly: the longest token (over 3 chars) of the short name
 *   must be contained in exactly one result name across both sets.</li>
 * </ol>
 * <p>Anything else stays unresolved: the test is linked to its requirements but counts as neither passing
 * nor failing.</p>
 */
public final class ResultLinker {

    private static final Logger log = LoggerFactory.getLogger(ResultLinker.class);

    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[_\\-.:\\s]+");
    private static final int MIN_TOKEN_LENGTH = 4;

    private final boolean strictBoundaries;

    public ResultLinker() {
        this(false);
    }

    /**
     * @param strictBoundaries when true, an exact match must be delimited by non-alphanumeric characters (or the
     *                         ends) of the result name, so {@code foo} no longer matches {@code foobar_suite}
     */
    public ResultLinker(boolean strictBoundaries) {
        this.strictBoundaries = strictBoundaries;
    }

    public LinkResult link(RequirementCatalog catalog, List<TestAnnotation> annotations, ResultSets results) {
        ResultSets res = results == null ? ResultSets.empty() : results;
        Map<String, Set<String>> tests = new LinkedHashMap<>();
        Map<String, Set<String>> passing = new LinkedHashMap<>();
        Map<String, Set<String>> failing = new LinkedHashMap<>();
        Set<String> unknown = new LinkedHashSet<>();
        List<TestLink> links = new ArrayList<>();

        for (TestAnnotation a : annotations == null ? List.<TestAnnotation>of() : annotations) {
            TestLink link = resolve(a, res);
            links.add(link);
            if (!link.isResolved()) {
                log.debug("No result found for {}", a.testId);
            }

            for (String rid : a.requirementIds) {
                if (!catalog.contains(rid)) {
                    unknown.add(rid);
                    continue;
                }
                tests.computeIfAbsent(rid, k -> new LinkedHashSet<>()).add(a.testId);
                if (link.outcome == TestOutcome.PASSED) {
                    passing.computeIfAbsent(rid, k -> new LinkedHashSet<>()).add(a.testId);
                } else if (link.outcome == TestOutcome.FAILED) {
                    failing.computeIfAbsent(rid, k -> new LinkedHashSet<>()).add(a.testId);
                }
            }
        }

        List<Requirement> updated = new ArrayList<>();
        for (Requirement r : catalog.requirements()) {
            String key = r.id.value;
            if (!tests.containsKey(key)) continue;
            updated.add(r.withLinks(tests.get(key), passing.get(key), failing.get(key)));
        }

        if (!unknown.isEmpty()) {
            log.warn("@satisfies annotations name {} identifier(s) without a definition: {}", unknown.size(), unknown);
        }
        return new LinkResult(catalog.withRequirements(updated), links, unknown);
    }

    /** Resolve one annotated test against the results. */
    public TestLink resolve(TestAnnotation annotation, ResultSets results) {
        String shortName = annotation.shortName();
        List<String> reqs = annotation.requirementIds;

        if (!shortName.isBlank()) {
            String passed = firstContaining(results.passing, shortName);
            if (passed != null) {
                return new TestLink(annotation.testId, shortName, reqs, TestOutcome.PASSED, MatchConfidence.EXACT, passed);
            }
            String failed = firstContaining(results.failing, shortName);
            if (failed != null) {
                return new TestLink(annotation.testId, shortName, reqs, TestOutcome.FAILED, MatchConfidence.EXACT, failed);
            }
        }

        String key = discriminatingToken(shortName);
        if (key == null) {
            return TestLink.unresolved(annotation.testId, shortName, reqs);
        }
        List<String> passCandidates = allContaining(results.passing, key);
        List<String> failCandidates = allContaining(results.failing, key);
        if (passCandidates.size() + failCandidates.size() != 1) {
            if (!passCandidates.isEmpty() || !failCandidates.isEmpty()) {
                log.debug("Ambiguous token '{}' for {}: {} passing / {} failing candidates",
                        key, annotation.testId, passCandidates.size(), failCandidates.size());
            }
            return TestLink.unresolved(annotation.testId, shortName, reqs);
        }
        if (passCandidates.size() == 1) {
            return new TestLink(annotation.testId, shortName, reqs, TestOutcome.PASSED, MatchConfidence.HEURISTIC, passCandidates.get(0));
        }
        return new TestLink(annotation.testId, shortName, reqs, TestOutcome.FAILED, MatchConfidence.HEURISTIC, failCandidates.get(0));
    }

    /**
     * Longest token of {@code shortName} longer than 3 characters (first one on ties), or null.
     */
    static String discriminatingToken(String shortName) {
        if (shortName == null) return null;
        String best = null;
        for (String token : TOKEN_SEPARATORS.split(shortName)) {
            if (token.length() < MIN_TOKEN_LENGTH) continue;
            if (best == null || token.length() > best.length()) best = token;
        }
        return best;
    }

    private String firstContaining(Collection<String> names, String needle) {
        for (String n : names) {
            if (matchesExactly(n, needle)) return n;
        }
        return null;
    }

    private static List<String> allContaining(Collection<String> names, String needle) {
        List<String> out = new ArrayList<>();
        for (String n : names) {
            if (n.contains(needle)) out.add(n);
        }
        return out;
    }

    boolean matchesExactly(String resultName, String shortName) {
        if (!strictBoundaries) return resultName.contains(shortName);
        int from = 0;
        while (true) {
            int idx = resultName.indexOf(shortName, from);
            if (idx < 0) return false;
            int end = idx + shortName.length();
            boolean leftOk = idx == 0 || !Character.isLetterOrDigit(resultName.charAt(idx - 1));
            boolean rightOk = end == resultName.length() || !Character.isLetterOrDigit(resultName.charAt(end));
            if (leftOk && rightOk) return true;
            from = idx + 1;
        }
    }
}
