package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.PathProgress;

import java.time.Instant;

/**
 * Learner progress records keyed by (learner, course) and (learner, path)
 */
public interface ProgressRepository {
    /**
     * Returns null when the learner has no progress for the course
     */
    CourseProgress getCourseProgress(String userId, String courseId);

    /**
     * Create the record only if none exists yet
     * @return false when another writer created it first
     */
    boolean createCourseProgressIfAbsent(CourseProgress progress);

    void saveCourseProgress(CourseProgress progress);

    /**
     * Advance the activity timestamps of an existing record without touching progress state
     */
    void touchCourseProgress(String userId, String courseId, Instant accessedAt);

    PathProgress getPathProgress(String userId, String pathId);

    void savePathProgress(PathProgress progress);
}
