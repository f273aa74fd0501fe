package uk.gegc.courseblocks.features.olx.domain.runtime;

import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;

import java.util.Map;

/**
 * Read-only course policy overlay: attribute values that override what the XML declares.
 */
public interface PolicySource {

    Map<String, Object> getPolicy(UsageKey usageId);

    static PolicySource empty() {
        return usageId -> Map.of();
    }
}
