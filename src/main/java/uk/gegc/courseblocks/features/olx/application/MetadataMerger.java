package uk.gegc.courseblocks.features.olx.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Attribute;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.olx.domain.model.BlockMetadata;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.FieldDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.FieldScope;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds block metadata from three sources, lowest precedence first: attributes of the definition
 * element, JSON embedded in a {@code <meta>} element, and the course policy.
 * <p>
 * Keys the block does not declare are kept in the {@code xml_attributes} bag so that they export unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetadataMerger {

    private final FieldCodec fieldCodec;
    private final OlxSettings settings;

    public BlockMetadata loadMetadata(Element definitionXml, BlockSchema schema) {
        BlockMetadata metadata = new BlockMetadata();
        for (Attribute attribute : definitionXml.attributes()) {
            String name = attribute.getQualifiedName();
            if (settings.metadataToStrip().contains(name)) {
                continue;
            }
            Optional<FieldDefinition> field = schema.field(name);
            if (field.isPresent()) {
                metadata.put(name, fieldCodec.deserialize(field.get().type(), attribute.getValue()));
            } else {
                metadata.putXmlAttribute(name, attribute.getValue());
            }
        }
        return metadata;
    }

    /**
     * Layers JSON metadata embedded in the definition. A document that fails to parse is recorded under
     * {@code definition_metadata_err} and the import carries on.
     */
    @SuppressWarnings("unchecked")
    public void applyDefinitionMetadata(BlockMetadata metadata, String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            return;
        }
        metadata.put(BlockMetadata.DEFINITION_METADATA_RAW, rawJson);
        try {
            Object parsed = fieldCodec.readJson(rawJson);
            if (!(parsed instanceof Map<?, ?> values)) {
                throw new IllegalArgumentException("Embedded metadata must be a JSON object");
            }
            ((Map<String, Object>) values).forEach(metadata::put);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.debug("Error in loading metadata {}", rawJson, ex);
            metadata.put(BlockMetadata.DEFINITION_METADATA_ERR, String.valueOf(ex.getMessage()));
        }
    }

    /**
     * Applies the policy overlay last. Keys unknown to the schema go into {@code xml_attributes}.
     */
    public void applyPolicy(BlockMetadata metadata, Map<String, Object> policy, BlockSchema schema) {
        if (policy == null) {
            return;
        }
        policy.forEach((attr, value) -> {
            if (schema.hasField(attr)) {
                metadata.put(attr, value);
            } else {
                metadata.putXmlAttribute(attr, value);
            }
        });
    }

    /**
     * Removes attributes named after settings-scope fields from {@code xmlObject}, except {@code excluded}.
     */
    public static void cleanMetadataFromXml(Element xmlObject, BlockSchema schema, Set<String> excluded) {
        List<Attribute> toRemove = new ArrayList<>();
        for (FieldDefinition field : schema.fieldsInScope(FieldScope.SETTINGS)) {
            if (excluded.contains(field.name())) {
                continue;
            }
            Attribute attribute = xmlObject.attribute(field.name());
            if (attribute != null) {
                toRemove.add(attribute);
            }
        }
        toRemove.forEach(xmlObject::remove);
    }
}
