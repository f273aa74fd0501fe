package uk.gegc.courseblocks.features.olx.infra;

import lombok.Builder;
import lombok.NonNull;
import uk.gegc.courseblocks.features.olx.application.BlockXmlHandler;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;
import uk.gegc.courseblocks.features.olx.domain.runtime.Aside;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;
import uk.gegc.courseblocks.features.olx.domain.runtime.IdGenerator;
import uk.gegc.courseblocks.features.olx.domain.runtime.PolicySource;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runtime assembled from plain collaborators. Blocks are constructed by their handler; asides come from an
 * optional provider function.
 */
@Builder
public class DefaultBlockRuntime implements BlockRuntime {

    @NonNull
    private final IdGenerator idGenerator;

    @NonNull
    private final ResourceStore resources;

    private final ResourceStore exportStore;

    @Builder.Default
    private final PolicySource policySource = PolicySource.empty();

    @Builder.Default
    private final Function<Block, List<Aside>> asideProvider = block -> List.of();

    @Override
    public IdGenerator idGenerator() {
        return idGenerator;
    }

    @Override
    public ResourceStore resources() {
        return resources;
    }

    @Override
    public ResourceStore exportStore() {
        return exportStore != null ? exportStore : resources;
    }

    @Override
    public Map<String, Object> getPolicy(UsageKey usageId) {
        return policySource.getPolicy(usageId);
    }

    @Override
    public Block constructBlock(BlockXmlHandler handler, ScopeIds keys) {
        return handler.newBlock(keys);
    }

    @Override
    public List<Aside> getAsides(Block block) {
        List<Aside> asides = asideProvider.apply(block);
        return asides == null ? List.of() : asides;
    }
}
