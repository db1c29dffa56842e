package ebulter.lms.lambda.service;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.LearningPath;
import ebulter.lms.lambda.model.PathCourseRef;
import ebulter.lms.lambda.model.PathProgress;
import ebulter.lms.lambda.model.PathRollup;
import ebulter.lms.lambda.model.PathStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Derives path level progress from the learner's course progress.
 * <p>
 * Pure: the same path, course snapshot, existing record and {@code now} always produce the same rollup.
 * Timestamps already present on the existing record are carried over unchanged.
 */
public class PathRollupCalculator {

    /**
     * @param courseProgress progress by course id; courses without an entry count as not started
     * @param existing       the stored path progress, or null when there is none yet
     * @param now            completion time to stamp if the path completes in this computation
     */
    public PathRollup computeRollup(LearningPath path, Map<String, CourseProgress> courseProgress,
                                    PathProgress existing, Instant now) {
        int totalCourses = path.getCourses().size();
        int completedCourses = 0;
        boolean anyStarted = false;
        String nextCourseId = null;
        Instant earliestStart = null;
        Instant latestAccess = null;

        for (PathCourseRef ref : path.getCourses()) {
            CourseProgress progress = courseProgress.get(ref.getCourseId());
            boolean completed = progress != null && progress.isCompleted();
            if (completed) {
                completedCourses++;
            }
            if (progress != null && progress.isStarted()) {
                anyStarted = true;
            }
            if (nextCourseId == null && ref.isRequired() && !completed) {
                nextCourseId = ref.getCourseId();
            }
            if (progress != null) {
                earliestStart = earliest(earliestStart, progress.getStartedAt());
                latestAccess = latest(latestAccess, progress.getLastAccessedAt());
            }
        }

        int percentComplete = totalCourses == 0 ? 0 : (int) Math.round(100.0 * completedCourses / totalCourses);

        PathStatus status;
        if (totalCourses > 0 && completedCourses == totalCourses) {
            status = PathStatus.COMPLETED;
        } else if (!anyStarted) {
            status = PathStatus.NOT_STARTED;
        } else {
            status = PathStatus.IN_PROGRESS;
        }

        Instant startedAt = existing != null && existing.getStartedAt() != null ? existing.getStartedAt() : earliestStart;
        Instant completedAt = existing != null ? existing.getCompletedAt() : null;
        if (completedAt == null && status == PathStatus.COMPLETED) {
            completedAt = now;
        }
        Instant lastActivityAt = latest(existing != null ? existing.getLastActivityAt() : null, latestAccess);

        return new PathRollup(totalCourses, completedCourses, percentComplete, status, nextCourseId,
                startedAt, completedAt, lastActivityAt);
    }

    private static Instant earliest(Instant current, Instant candidate) {
        if (candidate == null) return current;
        if (current == null) return candidate;
        return candidate.isBefore(current) ? candidate : current;
    }

    private static Instant latest(Instant current, Instant candidate) {
        if (candidate == null) return current;
        if (current == null) return candidate;
        return candidate.isAfter(current) ? candidate : current;
    }
}
