package uk.gegc.courseblocks.features.olx.domain.model;

/**
 * Keys under which a block stores its data.
 *
 * @param userId       bound learner, {@code null} while authoring or importing
 * @param blockType    the block category, e.g. {@code html}
 * @param definitionId key of the shared definition
 * @param usageId      key of this usage; its block id is the {@code url_name}
 */
public record ScopeIds(String userId, String blockType, DefinitionKey definitionId, UsageKey usageId) {

    public ScopeIds {
        if (blockType == null || blockType.isBlank()) {
            throw new IllegalArgumentException("blockType cannot be null or blank");
        }
        if (usageId == null) {
            throw new IllegalArgumentException("usageId cannot be null");
        }
    }
}
