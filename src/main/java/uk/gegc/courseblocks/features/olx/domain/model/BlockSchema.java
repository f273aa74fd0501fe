package uk.gegc.courseblocks.features.olx.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable set of fields declared by a block type.
 */
public final class BlockSchema {

    public static final String XML_ATTRIBUTES = "xml_attributes";

    private final Map<String, FieldDefinition> fields;

    private BlockSchema(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static BlockSchema of(FieldDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static BlockSchema of(Collection<FieldDefinition> definitions) {
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate field declared: " + definition.name());
            }
        }
        return new BlockSchema(byName);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public Optional<FieldDefinition> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public FieldDefinition require(String name) {
        FieldDefinition definition = fields.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown field: " + name);
        }
        return definition;
    }

    public Collection<FieldDefinition> fields() {
        return fields.values();
    }

    public List<FieldDefinition> fieldsInScope(FieldScope scope) {
        return fields.values().stream()
                .filter(field -> field.scope() == scope)
                .toList();
    }
}
