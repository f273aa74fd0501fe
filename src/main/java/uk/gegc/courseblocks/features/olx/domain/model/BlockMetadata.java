package uk.gegc.courseblocks.features.olx.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field values merged from XML attributes, embedded metadata and policy, plus the bag of attributes the
 * block does not declare. The bag is always present.
 */
public class BlockMetadata {

    public static final String DEFINITION_METADATA_RAW = "definition_metadata_raw";
    public static final String DEFINITION_METADATA_ERR = "definition_metadata_err";

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Object> xmlAttributes = new LinkedHashMap<>();

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, Object> getXmlAttributes() {
        return xmlAttributes;
    }

    public void putXmlAttribute(String key, Object value) {
        xmlAttributes.put(key, value);
    }

    /**
     * Flattened view with the unhandled bag under {@code xml_attributes}, as handed to the materializer.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> result = new LinkedHashMap<>(values);
        result.put(BlockSchema.XML_ATTRIBUTES, new LinkedHashMap<>(xmlAttributes));
        return result;
    }
}
