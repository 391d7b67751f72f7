package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.model.DuplicateDefinition;
import info.isaksson.erland.tracematrix.model.Identifier;
import info.isaksson.erland.tracematrix.model.Occurrence;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.ScannedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Fold scanned documents into one canonical {@link Requirement} per defined identifier.
 *
 * <p>Documents must be supplied in canonical scan order. The first definition of an identifier wins; each
 * further definition is kept as a {@link DuplicateDefinition} entry. References never create catalog entries
 * or conflicts; identifiers that are only referenced are reported as orphan references.</p>
 */
public final class DefinitionIndex {

    private static final Logger log = LoggerFactory.getLogger(DefinitionIndex.class);

    private DefinitionIndex() {}

    public static RequirementCatalog build(List<ScannedDocument> documents) {
        Map<String, Requirement> canonical = new LinkedHashMap<>();
        Map<String, List<String>> definitionPaths = new LinkedHashMap<>();
        Map<String, String> firstReference = new LinkedHashMap<>();

        for (ScannedDocument doc : documents == null ? List.<ScannedDocument>of() : documents) {
            for (Occurrence occ : doc.occurrences) {
                String key = occ.id.value;
                if (!occ.isDefinition()) {
                    firstReference.putIfAbsent(key, doc.path);
                    continue;
                }
                definitionPaths.computeIfAbsent(key, k -> new ArrayList<>()).add(doc.path);
                if (!canonical.containsKey(key)) {
                    canonical.put(key, toRequirement(occ, doc));
                }
            }
        }

        List<DuplicateDefinition> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : definitionPaths.entrySet()) {
            List<String> paths = e.getValue();
            if (paths.size() > 1) {
                DuplicateDefinition d = new DuplicateDefinition(e.getKey(), paths.size() - 1, paths);
                log.warn("Duplicate definition of {} (keeping {}; extra definitions: {})",
                        d.id, paths.get(0), d.extraDefinitions);
                conflicts.add(d);
            }
        }

        Map<String, String> orphans = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : firstReference.entrySet()) {
            if (!canonical.containsKey(e.getKey())) orphans.put(e.getKey(), e.getValue());
        }

        log.info("Indexed {} definition(s), {} duplicate(s), {} orphan reference(s)",
                canonical.size(), conflicts.size(), orphans.size());
        return new RequirementCatalog(canonical, conflicts, orphans);
    }

    private static Requirement toRequirement(Occurrence def, ScannedDocument doc) {
        return new Requirement(def.id, def.title, def.priority, def.acceptanceCriteria,
                doc.path, doc.contentHash, referencesOf(doc, def.id));
    }

    /** Identifiers mentioned in {@code doc} other than {@code self}, sorted. */
    static List<String> referencesOf(ScannedDocument doc, Identifier self) {
        TreeSet<String> refs = new TreeSet<>();
        for (Occurrence o : doc.occurrences) {
            if (!o.id.equals(self)) refs.add(o.id.value);
        }
        return new ArrayList<>(refs);
    }
}
