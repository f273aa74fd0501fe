package uk.gegc.courseblocks.features.olx.application;

import org.dom4j.Element;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;

public interface OlxExportService {

    /**
     * Export a block into a new node; side files go to the runtime's export store
     */
    Element exportBlock(Block block, BlockRuntime runtime);

    /**
     * Export a block into an existing node, replacing its name and attributes
     */
    void exportBlock(Block block, Element node, BlockRuntime runtime);

    /**
     * Export a block and render the resulting node as XML text
     */
    String exportToString(Block block, BlockRuntime runtime);
}
