package ebulter.lms.lambda.model;

import java.time.Instant;

/**
 * Progress of one learner in one learning path. Owned by (userId, pathId).
 */
public class PathProgress {
    private String userId;
    private String pathId;
    private EnrollmentOrigin enrollmentOrigin;
    private Instant enrolledAt;
    private int totalCourses;
    private int completedCourses;
    private int percentComplete;
    private PathStatus status = PathStatus.NOT_STARTED;
    private boolean completed;          // Follows status
    private Instant completedAt;        // Set once, never cleared
    private String nextCourseId;        // First required incomplete course, in path order
    private Instant startedAt;          // Set once
    private Instant lastActivityAt;
    private Instant updatedAt;

    public PathProgress() {
    }

    public PathProgress(String userId, String pathId, EnrollmentOrigin enrollmentOrigin, Instant enrolledAt) {
        this.userId = userId;
        this.pathId = pathId;
        this.enrollmentOrigin = enrollmentOrigin;
        this.enrolledAt = enrolledAt;
        this.updatedAt = enrolledAt;
    }

    /**
     * Copy the computed rollup fields onto this record. Enrollment fields are left untouched.
     */
    public void applyRollup(PathRollup rollup, Instant now) {
        this.totalCourses = rollup.getTotalCourses();
        this.completedCourses = rollup.getCompletedCourses();
        this.percentComplete = rollup.getPercentComplete();
        this.status = rollup.getStatus();
        this.completed = rollup.getStatus() == PathStatus.COMPLETED;
        this.nextCourseId = rollup.getNextCourseId();
        this.startedAt = rollup.getStartedAt();
        this.completedAt = rollup.getCompletedAt();
        this.lastActivityAt = rollup.getLastActivityAt();
        this.updatedAt = now;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getPathId() {
        return pathId;
    }

    public void setPathId(String pathId) {
        this.pathId = pathId;
    }

    public EnrollmentOrigin getEnrollmentOrigin() {
        return enrollmentOrigin;
    }

    public void setEnrollmentOrigin(EnrollmentOrigin enrollmentOrigin) {
        this.enrollmentOrigin = enrollmentOrigin;
    }

    public Instant getEnrolledAt() {
        return enrolledAt;
    }

    public void setEnrolledAt(Instant enrolledAt) {
        this.enrolledAt = enrolledAt;
    }

    public int getTotalCourses() {
        return totalCourses;
    }

    public void setTotalCourses(int totalCourses) {
        this.totalCourses = totalCourses;
    }

    public int getCompletedCourses() {
        return completedCourses;
    }

    public void setCompletedCourses(int completedCourses) {
        this.completedCourses = completedCourses;
    }

    public int getPercentComplete() {
        return percentComplete;
    }

    public void setPercentComplete(int percentComplete) {
        this.percentComplete = percentComplete;
    }

    public PathStatus getStatus() {
        return status;
    }

    public void setStatus(PathStatus status) {
        this.status = status;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public String getNextCourseId() {
        return nextCourseId;
    }

    public void setNextCourseId(String nextCourseId) {
        this.nextCourseId = nextCourseId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(Instant lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
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

        PathProgress that = (PathProgress) o;
        return userId.equals(that.userId) && pathId.equals(that.pathId);
    }

    @Override
    public int hashCode() {
        int result = userId.hashCode();
        result = 31 * result + pathId.hashCode();
        return result;
    }
}
