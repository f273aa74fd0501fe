package uk.gegc.courseblocks.features.olx.application;

import org.dom4j.Element;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;

public interface OlxImportService {

    /**
     * Import a block from an OLX node, generating its keys from the runtime's id generator
     */
    Block importBlock(Element node, BlockRuntime runtime);

    /**
     * Import a block from an OLX node using the given keys
     */
    Block importBlock(Element node, BlockRuntime runtime, ScopeIds keys);

    /**
     * Parse an OLX fragment and import the block it describes
     */
    Block importBlock(String xml, BlockRuntime runtime);
}
