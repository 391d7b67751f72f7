package info.isaksson.erland.tracematrix.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Flat identifier index ({@code spec-index.json}): one item per identifier seen in the
 * requirement documents, the ids with duplicate definitions, and the ignore patterns in effect.
 */
@JsonPropertyOrder({"items", "duplicateDefinitionIds", "ignoredPatterns"})
public final class SpecIndex {
    public final List<Item> items;
    public final List<String> duplicateDefinitionIds;
    public final List<String> ignoredPatterns;

    public SpecIndex(List<Item> items, List<String> duplicateDefinitionIds, List<String> ignoredPatterns) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.duplicateDefinitionIds = duplicateDefinitionIds == null ? List.of() : List.copyOf(duplicateDefinitionIds);
        this.ignoredPatterns = ignoredPatterns == null ? List.of() : List.copyOf(ignoredPatterns);
    }

    @JsonPropertyOrder({"id", "title", "path", "references", "hash", "sourceType"})
    public static final class Item {
        public final String id;
        public final String title;
        public final String path;
        public final List<String> references;
        public final String hash;
        /** {@code definition} or {@code reference}. */
        public final String sourceType;

        public Item(String id, String title, String path, List<String> references, String hash, String sourceType) {
            this.id = Objects.requireNonNull(id, "id");
            this.title = title == null ? "" : title;
            this.path = path == null ? "" : path;
            this.references = references == null ? List.of() : List.copyOf(references);
            this.hash = hash == null ? "" : hash;
            this.sourceType = sourceType == null ? "reference" : sourceType;
        }
    }
}
