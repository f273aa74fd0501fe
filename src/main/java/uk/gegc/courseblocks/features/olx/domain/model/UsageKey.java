package uk.gegc.courseblocks.features.olx.domain.model;

/**
 * Identifies one usage of a block inside a course. {@code blockId} doubles as the OLX {@code url_name}.
 */
public record UsageKey(CourseKey courseKey, String blockType, String blockId) implements OpaqueKey {

    public UsageKey {
        if (blockType == null || blockType.isBlank()) {
            throw new IllegalArgumentException("blockType cannot be null or blank");
        }
        if (blockId == null || blockId.isBlank()) {
            throw new IllegalArgumentException("blockId cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        String prefix = courseKey != null ? courseKey.toString().replace("course-v1:", "block-v1:") + "+" : "block-v1:";
        return prefix + "type@" + blockType + "+block@" + blockId;
    }
}
