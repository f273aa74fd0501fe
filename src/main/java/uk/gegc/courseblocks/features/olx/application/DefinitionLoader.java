package uk.gegc.courseblocks.features.olx.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Attribute;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.olx.domain.model.Definition;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionContent;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionFilename;
import uk.gegc.courseblocks.features.olx.domain.model.LoadedDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.runtime.Aside;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;
import uk.gegc.courseblocks.shared.exception.UnresolvedContentReferenceException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns an OLX node, inline or pointer, into a {@link Definition}.
 * <p>
 * Pointer tags are followed to their definition file through the runtime's resource store. Files that are
 * missing at their canonical path are looked up at the historical locations given by
 * {@link PointerTags#backcompatPaths(String)}; when none exists the load fails rather than producing an
 * empty block.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefinitionLoader {

    static final String FILENAME_ATTRIBUTE = "filename";
    static final String META_ELEMENT = "meta";

    private final OlxSettings settings;

    public LoadedDefinition load(Element node, BlockXmlHandler handler, BlockRuntime runtime, ScopeIds keys) {
        String definitionId = String.valueOf(keys.definitionId());
        ResourceStore store = runtime.resources();

        if (!PointerTags.isPointer(node)) {
            return loadDefinition(node, handler, store, keys);
        }

        String pointerPath = PointerTags.pointerPath(node, settings.filenameExtension());
        String resolved = resolvePath(pointerPath, store);
        LoadedDefinition loaded;
        if (isRawContent(resolved, handler)) {
            DefinitionContent content = handler.extractRawContent(readRaw(resolved, store, definitionId), resolved);
            loaded = new LoadedDefinition(OlxXml.copyOf(node), new Definition(content.fields()), content.children());
        } else {
            Element definitionXml = loadFile(resolved, store, definitionId);
            loaded = loadDefinition(definitionXml, handler, store, keys);
        }
        loaded.definition().setFilename(new DefinitionFilename(resolved, resolved));
        return loaded;
    }

    private LoadedDefinition loadDefinition(Element definitionXml,
                                            BlockXmlHandler handler,
                                            ResourceStore store,
                                            ScopeIds keys) {
        String definitionId = String.valueOf(keys.definitionId());
        String filename = definitionXml.attributeValue(FILENAME_ATTRIBUTE);

        Element ownXml = OlxXml.copyOf(definitionXml);
        List<Element> asideChildren = extractAsides(ownXml);
        String definitionMetadata = extractMeta(ownXml);

        Element contentXml;
        DefinitionFilename definitionFilename;
        if (filename == null) {
            contentXml = ownXml;
            definitionFilename = DefinitionFilename.NONE;
        } else {
            String referenced = handler.filenameReferencePath(
                    definitionXml.getName(), filename, keys.usageId(), settings);
            String resolved = resolvePath(referenced, store);
            definitionFilename = new DefinitionFilename(resolved, filename);

            if (isRawContent(resolved, handler)) {
                DefinitionContent content = handler.extractRawContent(readRaw(resolved, store, definitionId), resolved);
                Definition definition = new Definition(content.fields());
                definition.setFilename(definitionFilename);
                definition.setDefinitionMetadata(definitionMetadata);
                definition.addAsideChildren(asideChildren);
                return new LoadedDefinition(definitionXml, definition, content.children());
            }

            contentXml = loadFile(resolved, store, definitionId);
            for (Attribute attribute : definitionXml.attributes()) {
                contentXml.addAttribute(attribute.getQName(), attribute.getValue());
            }
            asideChildren.addAll(extractAsides(contentXml));
            String referencedMetadata = extractMeta(contentXml);
            if (referencedMetadata != null) {
                definitionMetadata = referencedMetadata;
            }
        }

        MetadataMerger.cleanMetadataFromXml(contentXml, handler.schema(), Set.of());
        DefinitionContent content = handler.extractContent(contentXml);

        Definition definition = new Definition(content.fields());
        definition.setFilename(definitionFilename);
        definition.setDefinitionMetadata(definitionMetadata);
        definition.addAsideChildren(asideChildren);
        return new LoadedDefinition(definitionXml, definition, content.children());
    }

    /**
     * Returns {@code path} if it exists, else the first existing backward-compatible location, else
     * {@code path} itself so that opening it reports the original location.
     */
    String resolvePath(String path, ResourceStore store) {
        if (store.exists(path)) {
            return path;
        }
        for (String candidate : PointerTags.backcompatPaths(path)) {
            if (store.exists(candidate)) {
                log.debug("Definition file {} not found, using {}", path, candidate);
                return candidate;
            }
        }
        return path;
    }

    Element loadFile(String path, ResourceStore store, String definitionId) {
        try (InputStream input = store.open(path)) {
            return OlxXml.parse(input);
        } catch (IOException | DocumentException ex) {
            throw new UnresolvedContentReferenceException(path, definitionId, ex);
        }
    }

    private String readRaw(String path, ResourceStore store, String definitionId) {
        try {
            return store.readString(path);
        } catch (IOException ex) {
            throw new UnresolvedContentReferenceException(path, definitionId, ex);
        }
    }

    private boolean isRawContent(String path, BlockXmlHandler handler) {
        return handler.rawContentExtension()
                .map(extension -> path.endsWith("." + extension))
                .orElse(false);
    }

    /**
     * Removes aside fragments (children marked with the aside family) and returns them in document order.
     */
    static List<Element> extractAsides(Element definitionXml) {
        List<Element> asides = new ArrayList<>();
        for (Element child : definitionXml.elements()) {
            if (Aside.ASIDE_FAMILY.equals(child.attributeValue(Aside.XBLOCK_FAMILY_ATTRIBUTE))) {
                asides.add(child);
            }
        }
        for (Element aside : asides) {
            definitionXml.remove(aside);
        }
        return asides;
    }

    /**
     * Removes an inline {@code <meta>} element and returns its raw text, or {@code null} if absent.
     */
    static String extractMeta(Element definitionXml) {
        Element meta = definitionXml.element(META_ELEMENT);
        if (meta == null) {
            return null;
        }
        String text = meta.getText();
        definitionXml.remove(meta);
        return text == null || text.isBlank() ? null : text;
    }
}
