package ebulter.lms.lambda.service;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.EnrollmentOrigin;
import ebulter.lms.lambda.model.LearningPath;
import ebulter.lms.lambda.model.PathCourseRef;
import ebulter.lms.lambda.model.PathProgress;
import ebulter.lms.lambda.model.PathProgressChange;
import ebulter.lms.lambda.model.PathRollup;
import ebulter.lms.lambda.repository.ProgressRepository;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class PathProgressService {
    private static final Logger logger = LoggerFactory.getLogger(PathProgressService.class);

    private final ProgressRepository progressRepository;
    private final PathRollupCalculator rollupCalculator;
    private final TimeProvider timeProvider;

    public PathProgressService(ProgressRepository progressRepository, PathRollupCalculator rollupCalculator,
                               TimeProvider timeProvider) {
        this.progressRepository = progressRepository;
        this.rollupCalculator = rollupCalculator;
        this.timeProvider = timeProvider;
    }

    /**
     * Rollup for the learner's current course progress. Reads only, nothing is written.
     */
    public PathRollup computeRollup(String userId, LearningPath path, PathProgress existing) {
        return computeRollup(userId, path, existing, timeProvider.now());
    }

    /**
     * Recompute and persist the learner's path progress. A missing record is created with the given origin,
     * an existing one keeps its enrollment fields and timestamps.
     */
    public PathProgressChange recompute(String userId, LearningPath path, EnrollmentOrigin originIfNew) {
        Instant now = timeProvider.now();
        PathProgress existing = progressRepository.getPathProgress(userId, path.getPathId());
        PathRollup rollup = computeRollup(userId, path, existing, now);

        boolean created = existing == null;
        PathProgress progress = created
                ? new PathProgress(userId, path.getPathId(), originIfNew != null ? originIfNew : EnrollmentOrigin.SELF_ENROLLED, now)
                : existing;
        boolean wasCompleted = !created && existing.isCompleted();

        progress.applyRollup(rollup, now);
        progressRepository.savePathProgress(progress);

        logger.info("Path progress user={} path={} completedCourses={}/{} percent={} status={}",
                userId, path.getPathId(), rollup.getCompletedCourses(), rollup.getTotalCourses(),
                rollup.getPercentComplete(), rollup.getStatus().getValue());
        return new PathProgressChange(progress, wasCompleted, created);
    }

    private PathRollup computeRollup(String userId, LearningPath path, PathProgress existing, Instant now) {
        Map<String, CourseProgress> courseProgress = new HashMap<>();
        for (PathCourseRef ref : path.getCourses()) {
            CourseProgress progress = progressRepository.getCourseProgress(userId, ref.getCourseId());
            if (progress != null) {
                courseProgress.put(ref.getCourseId(), progress);
            }
        }
        return rollupCalculator.computeRollup(path, courseProgress, existing, now);
    }
}
