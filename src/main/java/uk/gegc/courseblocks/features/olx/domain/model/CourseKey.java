package uk.gegc.courseblocks.features.olx.domain.model;

/**
 * Identifies a course run.
 */
public record CourseKey(String org, String course, String run) implements OpaqueKey {

    public CourseKey {
        if (org == null || org.isBlank()) {
            throw new IllegalArgumentException("org cannot be null or blank");
        }
        if (course == null || course.isBlank()) {
            throw new IllegalArgumentException("course cannot be null or blank");
        }
        if (run == null || run.isBlank()) {
            throw new IllegalArgumentException("run cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "course-v1:" + org + "+" + course + "+" + run;
    }
}
