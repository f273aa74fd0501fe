package uk.gegc.courseblocks.features.olx.infra;

import uk.gegc.courseblocks.features.olx.domain.model.CourseKey;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionKey;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;
import uk.gegc.courseblocks.features.olx.domain.runtime.IdGenerator;

import java.util.UUID;

/**
 * Issues keys inside a single course. Blocks without a {@code url_name} get a random 32-character hex id.
 */
public class CourseScopedIdGenerator implements IdGenerator {

    private final CourseKey courseKey;

    public CourseScopedIdGenerator(CourseKey courseKey) {
        this.courseKey = courseKey;
    }

    @Override
    public DefinitionKey createDefinition(String blockType, String urlName) {
        String blockId = urlName == null || urlName.isBlank()
                ? UUID.randomUUID().toString().replace("-", "")
                : urlName;
        return new DefinitionKey(courseKey, blockType, blockId);
    }

    @Override
    public UsageKey createUsage(DefinitionKey definitionId) {
        return new UsageKey(definitionId.courseKey(), definitionId.blockType(), definitionId.blockId());
    }
}
