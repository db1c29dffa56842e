package ebulter.lms.lambda.model;

import java.time.Instant;

/**
 * Reverse index entry: a published path contains this course.
 */
public class CoursePathMapping {
    public static final String STATUS_PUBLISHED = "published";

    private String courseId;
    private String pathId;
    private String pathStatus;
    private Instant updatedAt;

    public CoursePathMapping() {
    }

    public CoursePathMapping(String courseId, String pathId, String pathStatus, Instant updatedAt) {
        this.courseId = courseId;
        this.pathId = pathId;
        this.pathStatus = pathStatus;
        this.updatedAt = updatedAt;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public String getPathId() {
        return pathId;
    }

    public void setPathId(String pathId) {
        this.pathId = pathId;
    }

    public String getPathStatus() {
        return pathStatus;
    }

    public void setPathStatus(String pathStatus) {
        this.pathStatus = pathStatus;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        CoursePathMapping that = (CoursePathMapping) o;
        return courseId.equals(that.courseId) && pathId.equals(that.pathId);
    }

    @Override
    public int hashCode() {
        int result = courseId.hashCode();
        result = 31 * result + pathId.hashCode();
        return result;
    }
}
