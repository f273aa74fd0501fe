package uk.gegc.courseblocks.features.olx.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Attribute;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Node;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.CourseKey;
import uk.gegc.courseblocks.features.olx.domain.model.FieldScope;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;
import uk.gegc.courseblocks.features.olx.domain.runtime.Aside;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;
import uk.gegc.courseblocks.shared.exception.ContentExportException;
import uk.gegc.courseblocks.shared.exception.FieldSerializationException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;

/**
 * Writes a block back to OLX: explicitly set settings become attributes, unhandled attributes are
 * re-emitted verbatim and the definition either goes to its own file or is inlined into the node.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockExporter {

    static final String ASIDE_WRAPPER = "unknown_root";
    static final Map<String, String> XML_NAMESPACES = Map.of(
            "option", "http://code.edx.org/xblock/option",
            "block", "http://code.edx.org/xblock/block"
    );

    private final FieldCodec fieldCodec;
    private final OlxSettings settings;

    public void addXmlToNode(Block block, BlockXmlHandler handler, Element node, BlockRuntime runtime) {
        Element xmlObject;
        try {
            xmlObject = handler.definitionToXml(block, runtime.exportStore());
        } catch (IOException ex) {
            throw new ContentExportException("Failed to export definition of " + block.getLocation(), ex);
        }
        if (xmlObject == null) {
            log.warn("No XML definition produced for {} block {}; skipping", block.getCategory(), block.getUrlName());
            return;
        }

        for (Aside aside : runtime.getAsides(block)) {
            if (aside.needsSerialization()) {
                Element asideNode = DocumentHelper.createElement(ASIDE_WRAPPER);
                XML_NAMESPACES.forEach(asideNode::addNamespace);
                aside.addXmlToNode(asideNode);
                xmlObject.add(asideNode);
            }
        }

        String category = block.getCategory();
        Set<String> notToClean = settings.notToCleanFor(category);
        MetadataMerger.cleanMetadataFromXml(xmlObject, block.getSchema(), notToClean);

        xmlObject.setName(category);
        node.setName(category);

        for (Map.Entry<String, Object> entry : block.getExplicitlySetFields(FieldScope.SETTINGS).entrySet()) {
            String attr = entry.getKey();
            if (settings.metadataToStrip().contains(attr)
                    || settings.metadataToExportToPolicy().contains(attr)
                    || notToClean.contains(attr)) {
                continue;
            }
            setAttribute(xmlObject, attr, entry.getValue(), block);
        }

        for (Map.Entry<String, Object> entry : block.getXmlAttributes().entrySet()) {
            if (!settings.metadataToStrip().contains(entry.getKey())) {
                setAttribute(xmlObject, entry.getKey(), entry.getValue(), block);
            }
        }

        if (handler.exportToFile()) {
            String name = PointerTags.COURSE_CATEGORY.equals(category) && block.getLocation().courseKey() != null
                    ? block.getLocation().courseKey().run()
                    : PointerTags.nameToPathname(block.getUrlName());
            writeDefinitionFile(runtime.exportStore(),
                    PointerTags.formatFilepath(category, name, settings.filenameExtension()),
                    xmlObject);
        } else {
            replaceContent(node, xmlObject);
        }

        if (node.attributeValue(PointerTags.URL_NAME) == null || node.attributeValue(PointerTags.URL_NAME).isEmpty()) {
            node.addAttribute(PointerTags.URL_NAME, block.getUrlName());
        }

        CourseKey courseKey = block.getLocation().courseKey();
        if (PointerTags.COURSE_CATEGORY.equals(category) && courseKey != null) {
            node.addAttribute("org", courseKey.org());
            node.addAttribute("course", courseKey.course());
        }
    }

    private void setAttribute(Element xmlObject, String attr, Object value, Block block) {
        try {
            xmlObject.addAttribute(attr, fieldCodec.serialize(value));
        } catch (FieldSerializationException | IllegalArgumentException ex) {
            log.error("Failed to serialize metadata attribute {} with value {} in block {}. This could mean data loss!",
                    attr, value, block.getUrlName(), ex);
        }
    }

    private void writeDefinitionFile(ResourceStore store, String filepath, Element xmlObject) {
        try {
            byte[] content = OlxXml.toPrettyBytes(xmlObject);
            store.makedirs(PointerTags.parentOf(filepath));
            store.write(filepath, content);
            log.debug("Wrote definition file {}", filepath);
        } catch (IOException ex) {
            throw new ContentExportException("Failed to write definition file " + filepath, ex);
        }
    }

    private static void replaceContent(Element node, Element xmlObject) {
        node.clearContent();
        for (Attribute attribute : new ArrayList<>(node.attributes())) {
            node.remove(attribute);
        }
        node.setName(xmlObject.getName());
        for (Attribute attribute : xmlObject.attributes()) {
            node.addAttribute(attribute.getQName(), attribute.getValue());
        }
        for (Node child : xmlObject.content()) {
            node.add((Node) child.clone());
        }
    }
}
