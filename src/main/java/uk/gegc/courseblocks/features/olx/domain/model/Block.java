package uk.gegc.courseblocks.features.olx.domain.model;

import uk.gegc.courseblocks.features.olx.domain.runtime.Aside;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Base class for all course content blocks.
 * <p>
 * Field values are held by name and validated against the block's {@link BlockSchema}. Every read returns
 * an owned copy and every write replaces the stored value, so containers obtained from a getter must be
 * modified and then assigned back with {@link #setField(String, Object)}.
 */
public abstract class Block {

    private final ScopeIds scopeIds;
    private final BlockSchema schema;
    private final Map<String, Object> explicitValues = new LinkedHashMap<>();
    private final List<String> children = new ArrayList<>();
    private final List<Aside> asides = new ArrayList<>();

    protected Block(ScopeIds scopeIds, BlockSchema schema) {
        if (scopeIds == null) {
            throw new IllegalArgumentException("ScopeIds cannot be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("BlockSchema cannot be null");
        }
        this.scopeIds = scopeIds;
        this.schema = schema;
    }

    public ScopeIds getScopeIds() {
        return scopeIds;
    }

    public BlockSchema getSchema() {
        return schema;
    }

    public String getCategory() {
        return scopeIds.blockType();
    }

    public UsageKey getLocation() {
        return scopeIds.usageId();
    }

    public String getUrlName() {
        return scopeIds.usageId().blockId();
    }

    public Object getField(String name) {
        FieldDefinition definition = schema.require(name);
        if (explicitValues.containsKey(name)) {
            return FieldValues.copyOf(explicitValues.get(name));
        }
        return definition.defaultCopy();
    }

    public void setField(String name, Object value) {
        schema.require(name);
        explicitValues.put(name, FieldValues.copyOf(value));
    }

    public void clearField(String name) {
        schema.require(name);
        explicitValues.remove(name);
    }

    public boolean isExplicitlySet(String name) {
        return explicitValues.containsKey(name);
    }

    /**
     * JSON-compatible values of the fields in {@code scope} that were set explicitly (including to
     * {@code null}), keyed and sorted by field name.
     */
    public Map<String, Object> getExplicitlySetFields(FieldScope scope) {
        Map<String, Object> result = new TreeMap<>();
        for (FieldDefinition field : schema.fieldsInScope(scope)) {
            if (explicitValues.containsKey(field.name())) {
                result.put(field.name(), field.type().toJson(explicitValues.get(field.name())));
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getXmlAttributes() {
        Object value = getField(BlockSchema.XML_ATTRIBUTES);
        return value == null ? new LinkedHashMap<>() : (Map<String, Object>) value;
    }

    public void setXmlAttributes(Map<String, Object> xmlAttributes) {
        setField(BlockSchema.XML_ATTRIBUTES, xmlAttributes);
    }

    public String getDisplayName() {
        return (String) getField("display_name");
    }

    public void setDisplayName(String displayName) {
        setField("display_name", displayName);
    }

    public List<String> getChildren() {
        return List.copyOf(children);
    }

    public void setChildren(List<String> children) {
        this.children.clear();
        if (children != null) {
            this.children.addAll(children);
        }
    }

    public List<Aside> getAsides() {
        return Collections.unmodifiableList(asides);
    }

    public void addAside(Aside aside) {
        asides.add(aside);
    }
}
