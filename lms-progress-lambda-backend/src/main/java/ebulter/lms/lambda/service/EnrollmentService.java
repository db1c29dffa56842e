package ebulter.lms.lambda.service;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.EnrollmentOrigin;
import ebulter.lms.lambda.model.EnrollmentResult;
import ebulter.lms.lambda.repository.ProgressRepository;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Idempotent course enrollment. Re-enrolling never resets progress, only the activity timestamps move.
 */
public class EnrollmentService {
    private static final Logger logger = LoggerFactory.getLogger(EnrollmentService.class);

    private final ProgressRepository progressRepository;
    private final TimeProvider timeProvider;

    public EnrollmentService(ProgressRepository progressRepository, TimeProvider timeProvider) {
        this.progressRepository = progressRepository;
        this.timeProvider = timeProvider;
    }

    /**
     * Enroll the learner, or return the existing enrollment with its last access time advanced.
     */
    public EnrollmentResult enroll(String userId, String courseId, EnrollmentOrigin origin) {
        EnrollmentResult result = getOrCreate(userId, courseId, origin);
        if (!result.isCreated()) {
            touch(result.getProgress(), timeProvider.now());
        }
        return result;
    }

    /**
     * Fetch the course progress, creating an empty enrollment when there is none. Existing records are returned as read.
     */
    public EnrollmentResult getOrCreate(String userId, String courseId, EnrollmentOrigin origin) {
        CourseProgress existing = progressRepository.getCourseProgress(userId, courseId);
        if (existing != null) {
            return new EnrollmentResult(existing, false);
        }

        Instant now = timeProvider.now();
        CourseProgress progress = new CourseProgress(userId, courseId,
                origin != null ? origin : EnrollmentOrigin.SELF_ENROLLED, now);
        if (progressRepository.createCourseProgressIfAbsent(progress)) {
            logger.info("Enrolled user {} in course {} ({})", userId, courseId, progress.getEnrollmentOrigin().getValue());
            return new EnrollmentResult(progress, true);
        }

        // Lost the race against a concurrent enrollment, the winner's record is the enrollment
        CourseProgress winner = progressRepository.getCourseProgress(userId, courseId);
        if (winner == null) {
            throw new IllegalStateException("Course progress for user " + userId + " course " + courseId
                    + " was reported as existing but could not be read");
        }
        return new EnrollmentResult(winner, false);
    }

    private void touch(CourseProgress progress, Instant now) {
        if (progress.getLastAccessedAt() != null && !now.isAfter(progress.getLastAccessedAt())) {
            return;
        }
        progressRepository.touchCourseProgress(progress.getUserId(), progress.getCourseId(), now);
        progress.setLastAccessedAt(now);
    }
}
