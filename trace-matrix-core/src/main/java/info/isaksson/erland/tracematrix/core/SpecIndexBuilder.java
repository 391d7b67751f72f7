package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.io.TextFiles;
import info.isaksson.erland.tracematrix.model.Occurrence;
import info.isaksson.erland.tracematrix.model.Requirement;
import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.ScannedDocument;
import info.isaksson.erland.tracematrix.model.SpecIndex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@code spec-index.json} model: one item per identifier, in order of first appearance.
 * Defined identifiers come from the catalog; identifiers that are only referenced are described by the
 * first document mentioning them.
 */
public final class SpecIndexBuilder {

    public static final String SOURCE_DEFINITION = "definition";
    public static final String SOURCE_REFERENCE = "reference";

    private SpecIndexBuilder() {}

    public static SpecIndex build(RequirementCatalog catalog, List<ScannedDocument> documents, List<String> ignoredPatterns) {
        Map<String, SpecIndex.Item> items = new LinkedHashMap<>();
        for (ScannedDocument doc : documents) {
            for (Occurrence occ : doc.occurrences) {
                String key = occ.id.value;
                if (items.containsKey(key)) continue;
                Requirement r = catalog.get(key);
                if (r != null) {
                    items.put(key, new SpecIndex.Item(key, r.title, r.sourcePath, r.references,
                            r.contentHash, SOURCE_DEFINITION));
                } else {
                    items.put(key, new SpecIndex.Item(key, TextFiles.stem(fileName(doc.path)), doc.path,
                            DefinitionIndex.referencesOf(doc, occ.id), doc.contentHash, SOURCE_REFERENCE));
                }
            }
        }
        return new SpecIndex(new ArrayList<>(items.values()), catalog.conflictIds(), ignoredPatterns);
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
