package ebulter.lms.lambda.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Path level fields derived from the progress of the courses a path contains.
 */
public class PathRollup {
    private final int totalCourses;
    private final int completedCourses;
    private final int percentComplete;
    private final PathStatus status;
    private final String nextCourseId;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant lastActivityAt;

    public PathRollup(int totalCourses, int completedCourses, int percentComplete, PathStatus status,
                      String nextCourseId, Instant startedAt, Instant completedAt, Instant lastActivityAt) {
        this.totalCourses = totalCourses;
        this.completedCourses = completedCourses;
        this.percentComplete = percentComplete;
        this.status = status;
        this.nextCourseId = nextCourseId;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.lastActivityAt = lastActivityAt;
    }

    public int getTotalCourses() {
        return totalCourses;
    }

    public int getCompletedCourses() {
        return completedCourses;
    }

    public int getPercentComplete() {
        return percentComplete;
    }

    public PathStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == PathStatus.COMPLETED;
    }

    public String getNextCourseId() {
        return nextCourseId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        PathRollup that = (PathRollup) o;
        return totalCourses == that.totalCourses
                && completedCourses == that.completedCourses
                && percentComplete == that.percentComplete
                && status == that.status
                && Objects.equals(nextCourseId, that.nextCourseId)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(completedAt, that.completedAt)
                && Objects.equals(lastActivityAt, that.lastActivityAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalCourses, completedCourses, percentComplete, status, nextCourseId,
                startedAt, completedAt, lastActivityAt);
    }

    @Override
    public String toString() {
        return "PathRollup{" +
                "totalCourses=" + totalCourses +
                ", completedCourses=" + completedCourses +
                ", percentComplete=" + percentComplete +
                ", status=" + status +
                ", nextCourseId='" + nextCourseId + '\'' +
                '}';
    }
}
