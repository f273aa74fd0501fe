package uk.gegc.courseblocks.features.olx.application;

import lombok.extern.slf4j.Slf4j;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockMetadata;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.Definition;
import uk.gegc.courseblocks.features.olx.domain.model.FieldDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.LoadedDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.runtime.Aside;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies merged metadata and a loaded definition onto a freshly constructed block.
 */
@Component
@Slf4j
public class BlockMaterializer {

    static final String FILENAME_KEY = "filename";

    @SuppressWarnings("unchecked")
    public Block materialize(BlockXmlHandler handler,
                             BlockRuntime runtime,
                             ScopeIds keys,
                             BlockMetadata metadata,
                             LoadedDefinition loaded) {
        Block block = runtime.constructBlock(handler, keys);
        BlockSchema schema = block.getSchema();
        Definition definition = loaded.definition();

        Map<String, Object> fieldData = new LinkedHashMap<>(metadata.asMap());
        fieldData.putAll(definition.getFields());

        for (Map.Entry<String, Object> entry : fieldData.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (BlockSchema.XML_ATTRIBUTES.equals(key) && schema.hasField(key)) {
                Map<String, Object> xmlAttributes = block.getXmlAttributes();
                if (value instanceof Map<?, ?> incoming) {
                    xmlAttributes.putAll((Map<String, Object>) incoming);
                }
                xmlAttributes.put(FILENAME_KEY, definition.getFilename().asList());
                block.setXmlAttributes(xmlAttributes);
                continue;
            }
            Optional<FieldDefinition> field = schema.field(key);
            if (field.isEmpty()) {
                log.warn("Imported {} block does not have field {} found in XML.", block.getCategory(), key);
                continue;
            }
            try {
                block.setField(key, field.get().type().fromJson(value));
            } catch (IllegalArgumentException | ArithmeticException ex) {
                log.warn("Skipping field {} of {} block {}: {}",
                        key, block.getCategory(), block.getUrlName(), ex.getMessage());
            }
        }

        block.setChildren(loaded.children());
        attachAsides(block, runtime, definition.getAsideChildren());
        return block;
    }

    /**
     * Attaches the runtime's asides whose type matches one of the aside fragments found in the definition.
     */
    void attachAsides(Block block, BlockRuntime runtime, List<Element> asideChildren) {
        if (asideChildren.isEmpty()) {
            return;
        }
        Set<String> asideTags = asideChildren.stream()
                .map(Element::getName)
                .collect(Collectors.toSet());
        for (Aside aside : runtime.getAsides(block)) {
            if (asideTags.contains(aside.blockType())) {
                block.addAside(aside);
            }
        }
    }
}
