package uk.gegc.courseblocks.features.olx.domain.model;

public record DefinitionKey(CourseKey courseKey, String blockType, String blockId) implements OpaqueKey {

    public DefinitionKey {
        if (blockType == null || blockType.isBlank()) {
            throw new IllegalArgumentException("blockType cannot be null or blank");
        }
        if (blockId == null || blockId.isBlank()) {
            throw new IllegalArgumentException("blockId cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        String prefix = courseKey != null ? courseKey.toString().replace("course-v1:", "def-v1:") + "+" : "def-v1:";
        return prefix + "type@" + blockType + "+block@" + blockId;
    }
}
