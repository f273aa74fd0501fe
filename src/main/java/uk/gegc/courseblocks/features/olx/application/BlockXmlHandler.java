package uk.gegc.courseblocks.features.olx.application;

import org.dom4j.Element;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionContent;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;

import java.io.IOException;
import java.util.Optional;

/**
 * SPI for the block-specific parts of OLX import and export. The shared loader, merger and exporter call
 * these hooks and are otherwise type-agnostic.
 */
public interface BlockXmlHandler {

    /**
     * OLX tag handled, which is also the block category.
     */
    String category();

    BlockSchema schema();

    Block newBlock(ScopeIds keys);

    /**
     * Extracts block fields and child ids from a definition element. The element is a private copy with
     * settings attributes and {@code <meta>} already removed.
     */
    DefinitionContent extractContent(Element definitionXml);

    /**
     * Extension of files holding raw (non-XML) content for this block type, if any.
     */
    default Optional<String> rawContentExtension() {
        return Optional.empty();
    }

    /**
     * Builds the definition from a raw content file.
     */
    default DefinitionContent extractRawContent(String content, String path) {
        throw new UnsupportedOperationException(category() + " blocks do not read raw content files");
    }

    /**
     * Path of the file named by a legacy {@code filename} attribute.
     */
    default String filenameReferencePath(String tag, String filename, UsageKey usageId, OlxSettings settings) {
        return PointerTags.formatFilepath(tag, filename, settings.filenameExtension());
    }

    /**
     * Builds the element describing {@code block}'s definition, writing any side content to
     * {@code exportStore}. Returns {@code null} when the block cannot be serialized.
     */
    Element definitionToXml(Block block, ResourceStore exportStore) throws IOException;

    /**
     * Whether the exported definition goes to its own file, leaving a pointer tag in the parent.
     */
    default boolean exportToFile() {
        return true;
    }
}
