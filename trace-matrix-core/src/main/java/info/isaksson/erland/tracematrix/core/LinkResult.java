package info.isaksson.erland.tracematrix.core;

import info.isaksson.erland.tracematrix.model.RequirementCatalog;
import info.isaksson.erland.tracematrix.model.TestLink;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Output of {@link ResultLinker#link}. */
public final class LinkResult {
    /** Catalog whose requirements carry their test links. */
    public final RequirementCatalog catalog;
    public final List<TestLink> links;
    /** Identifiers named by annotations but not defined in the catalog. */
    public final Set<String> unknownRequirementRefs;

    public LinkResult(RequirementCatalog catalog, List<TestLink> links, Set<String> unknownRequirementRefs) {
        this.catalog = catalog;
        this.links = links == null ? List.of() : List.copyOf(links);
        this.unknownRequirementRefs = unknownRequirementRefs == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(unknownRequirementRefs));
    }
}
