package uk.gegc.courseblocks.features.olx.domain.model;

/**
 * One declared field of a block type.
 */
public record FieldDefinition(String name, FieldScope scope, FieldType type, Object defaultValue) {

    public FieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
        if (scope == null) {
            throw new IllegalArgumentException("Field scope cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null");
        }
        defaultValue = FieldValues.copyOf(defaultValue);
    }

    public static FieldDefinition of(String name, FieldScope scope, FieldType type) {
        return new FieldDefinition(name, scope, type, null);
    }

    public static FieldDefinition of(String name, FieldScope scope, FieldType type, Object defaultValue) {
        return new FieldDefinition(name, scope, type, defaultValue);
    }

    /**
     * Returns a fresh copy of the default so callers can never mutate the shared instance.
     */
    public Object defaultCopy() {
        return FieldValues.copyOf(defaultValue);
    }
}
