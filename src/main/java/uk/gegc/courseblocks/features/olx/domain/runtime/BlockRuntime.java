package uk.gegc.courseblocks.features.olx.domain.runtime;

import uk.gegc.courseblocks.features.olx.application.BlockXmlHandler;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;

import java.util.List;
import java.util.Map;

/**
 * Host services used while importing and exporting blocks.
 */
public interface BlockRuntime {

    IdGenerator idGenerator();

    /**
     * Store the course is imported from.
     */
    ResourceStore resources();

    /**
     * Store exported definition files are written to.
     */
    ResourceStore exportStore();

    Map<String, Object> getPolicy(UsageKey usageId);

    Block constructBlock(BlockXmlHandler handler, ScopeIds keys);

    /**
     * Asides available for {@code block}, attached or not.
     */
    List<Aside> getAsides(Block block);
}
