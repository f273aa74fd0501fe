package uk.gegc.courseblocks.features.olx.domain.model;

import org.dom4j.Element;

import java.util.List;

/**
 * Output of the definition loader.
 *
 * @param definitionXml element whose attributes carry the block metadata (the pointer target when the
 *                      imported node was a pointer)
 * @param definition    extracted fields and bookkeeping
 * @param children      child usage ids
 */
public record LoadedDefinition(Element definitionXml, Definition definition, List<String> children) {

    public LoadedDefinition {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
