package uk.gegc.courseblocks.features.olx.domain.runtime;

import uk.gegc.courseblocks.features.olx.domain.model.DefinitionKey;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;

public interface IdGenerator {

    /**
     * @param urlName the node's {@code url_name}, or {@code null} to generate one
     */
    DefinitionKey createDefinition(String blockType, String urlName);

    UsageKey createUsage(DefinitionKey definitionId);
}
