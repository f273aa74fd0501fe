package uk.gegc.courseblocks.features.olx.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;
import uk.gegc.courseblocks.features.olx.domain.runtime.PolicySource;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;
import uk.gegc.courseblocks.shared.exception.UnresolvedContentReferenceException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Course policy read from a {@code policy.json} file whose top-level keys are {@code category/url_name}.
 */
@Slf4j
public class JsonPolicySource implements PolicySource {

    public static final String DEFAULT_POLICY_PATH = "policy.json";

    private final Map<String, Map<String, Object>> policy;

    public JsonPolicySource(Map<String, Map<String, Object>> policy) {
        this.policy = policy == null ? Map.of() : Map.copyOf(policy);
    }

    /**
     * Reads the policy file at {@code path}. A missing file yields an empty policy.
     *
     * @throws UnresolvedContentReferenceException if the file exists but is not a JSON object of objects
     */
    public static JsonPolicySource load(ResourceStore store, String path, ObjectMapper objectMapper) {
        if (!store.exists(path)) {
            log.debug("No policy file at {}", path);
            return new JsonPolicySource(Map.of());
        }
        try (InputStream input = store.open(path)) {
            Map<String, Map<String, Object>> parsed =
                    objectMapper.readValue(input, new TypeReference<Map<String, Map<String, Object>>>() {
                    });
            log.debug("Loaded policy for {} blocks from {}", parsed.size(), path);
            return new JsonPolicySource(parsed);
        } catch (IOException e) {
            throw new UnresolvedContentReferenceException(path, "policy", e);
        }
    }

    @Override
    public Map<String, Object> getPolicy(UsageKey usageId) {
        Map<String, Object> entry = policy.get(usageId.blockType() + "/" + usageId.blockId());
        return entry == null ? Map.of() : new LinkedHashMap<>(entry);
    }
}
