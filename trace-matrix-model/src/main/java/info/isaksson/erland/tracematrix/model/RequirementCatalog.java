package info.isaksson.erland.tracematrix.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only catalog of canonical requirements keyed by identifier text.
 *
 * <p>Iteration order is the order in which definitions were first encountered.</p>
 */
public final class RequirementCatalog {
    private final Map<String, Requirement> requirements;
    public final List<DuplicateDefinition> conflicts;
    /** Identifiers that were only referenced, mapped to the first path referencing them (sorted by id). */
    public final Map<String, String> orphanReferences;

    public RequirementCatalog(Map<String, Requirement> requirements,
                              List<DuplicateDefinition> conflicts,
                              Map<String, String> orphanReferences) {
        this.requirements = requirements == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
        this.conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        this.orphanReferences = orphanReferences == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(orphanReferences));
    }

    public Requirement get(String id) {
        return requirements.get(id);
    }

    public boolean contains(String id) {
        return requirements.containsKey(id);
    }

    public Collection<Requirement> requirements() {
        return requirements.values();
    }

    public Map<String, Requirement> asMap() {
        return requirements;
    }

    public int size() {
        return requirements.size();
    }

    public boolean isEmpty() {
        return requirements.isEmpty();
    }

    /** Same conflicts and orphans, requirement records replaced (e.g. after linking). */
    public RequirementCatalog withRequirements(Collection<Requirement> replaced) {
        Map<String, Requirement> out = new LinkedHashMap<>(requirements);
        for (Requirement r : replaced) {
            if (out.containsKey(r.id.value)) out.put(r.id.value, r);
        }
        return new RequirementCatalog(out, conflicts, orphanReferences);
    }

    public List<String> conflictIds() {
        List<String> ids = new ArrayList<>();
        for (DuplicateDefinition d : conflicts) ids.add(d.id);
        return ids;
    }
}
