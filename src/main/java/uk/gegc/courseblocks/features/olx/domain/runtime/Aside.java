package uk.gegc.courseblocks.features.olx.domain.runtime;

import org.dom4j.Element;

/**
 * Auxiliary data attached to a block and serialized next to, but separately from, its fields.
 */
public interface Aside {

    String XBLOCK_FAMILY_ATTRIBUTE = "xblock-family";
    String ASIDE_FAMILY = "xblock_asides.v1";

    /**
     * Aside type; matched against the tag of aside fragments found in a definition.
     */
    String blockType();

    boolean needsSerialization();

    /**
     * Writes this aside onto {@code node}, renaming it and setting its attributes.
     */
    void addXmlToNode(Element node);
}
