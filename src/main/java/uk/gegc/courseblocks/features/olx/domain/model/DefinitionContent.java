package uk.gegc.courseblocks.features.olx.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Block-specific fields and child ids extracted from a definition's inner markup.
 */
public record DefinitionContent(Map<String, Object> fields, List<String> children) {

    public DefinitionContent {
        fields = fields == null ? Map.of() : fields;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static DefinitionContent of(Map<String, Object> fields) {
        return new DefinitionContent(fields, List.of());
    }
}
