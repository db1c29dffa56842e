package ebulter.lms.lambda.service;

import ebulter.lms.lambda.config.LmsConfig;
import ebulter.lms.lambda.event.LmsEvent;
import ebulter.lms.lambda.event.LmsEventPublisher;
import ebulter.lms.lambda.event.LmsEventType;
import ebulter.lms.lambda.exception.NotFoundException;
import ebulter.lms.lambda.model.*;
import ebulter.lms.lambda.repository.CatalogRepository;
import ebulter.lms.lambda.repository.CertificateRepository;
import ebulter.lms.lambda.repository.CoursePathIndexRepository;
import ebulter.lms.lambda.repository.ProgressRepository;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Entry point for learner progress operations.
 * <p>
 * Progress writes are the primary result of every call. Notifications, certificate issuance and the
 * path recomputation that follows a course completion are best effort: their failures are logged and
 * never undo or fail the progress write.
 */
public class LearningProgressEngine {
    private static final Logger logger = LoggerFactory.getLogger(LearningProgressEngine.class);

    private final CatalogRepository catalogRepository;
    private final ProgressRepository progressRepository;
    private final CertificateRepository certificateRepository;
    private final EnrollmentService enrollmentService;
    private final ProgressUpdater progressUpdater;
    private final PathProgressService pathProgressService;
    private final CoursePathIndexService coursePathIndexService;
    private final CertificateAwardService certificateAwardService;
    private final LmsEventPublisher eventPublisher;
    private final TimeProvider timeProvider;

    public LearningProgressEngine(CatalogRepository catalogRepository,
                                  ProgressRepository progressRepository,
                                  CoursePathIndexRepository coursePathIndexRepository,
                                  CertificateRepository certificateRepository,
                                  RecipientDirectory recipientDirectory,
                                  LmsEventPublisher eventPublisher,
                                  TimeProvider timeProvider,
                                  long progressEventIntervalMillis) {
        this.catalogRepository = catalogRepository;
        this.progressRepository = progressRepository;
        this.certificateRepository = certificateRepository;
        this.eventPublisher = eventPublisher;
        this.timeProvider = timeProvider;
        this.enrollmentService = new EnrollmentService(progressRepository, timeProvider);
        this.progressUpdater = new ProgressUpdater(progressRepository, enrollmentService, timeProvider, progressEventIntervalMillis);
        this.pathProgressService = new PathProgressService(progressRepository, new PathRollupCalculator(), timeProvider);
        this.coursePathIndexService = new CoursePathIndexService(coursePathIndexRepository, timeProvider);
        this.certificateAwardService = new CertificateAwardService(certificateRepository,
                new CertificateIssuer(certificateRepository, timeProvider), recipientDirectory, eventPublisher, timeProvider);
    }

    /**
     * Returns the learner's course progress, flagged as created when this call made the enrollment.
     */
    public EnrollmentResult enroll(String userId, String courseId, EnrollmentOrigin origin) {
        requireCourse(courseId);
        EnrollmentResult result = enrollmentService.enroll(userId, courseId, origin);
        if (result.isCreated()) {
            eventPublisher.publish(LmsEvent.of(LmsEventType.ENROLLMENT_CREATED, userId, timeProvider.now())
                    .withCourseId(courseId));
        }
        return result;
    }

    public ProgressUpdateResult applyProgress(String userId, String courseId, ProgressUpdate update) {
        if (update.getLessonId() == null || update.getLessonId().isBlank()) {
            throw new IllegalArgumentException("lesson_id is required");
        }
        Course course = requireCourse(courseId);

        ProgressUpdateResult result = progressUpdater.applyProgress(userId, courseId, update);
        CourseProgress progress = result.getProgress();

        if (result.shouldEmitEvent()) {
            eventPublisher.publish(LmsEvent.of(LmsEventType.PROGRESS_UPDATED, userId, progress.getUpdatedAt())
                    .withCourseId(courseId)
                    .withLessonId(update.getLessonId())
                    .withPercentComplete(progress.getPercentComplete()));
        }
        if (result.isLessonJustCompleted()) {
            eventPublisher.publish(LmsEvent.of(LmsEventType.LESSON_COMPLETED, userId, progress.getUpdatedAt())
                    .withCourseId(courseId)
                    .withLessonId(update.getLessonId()));
        }

        // A retried final completion re-drives the cascade; every step of it is idempotent
        if (result.isCourseJustCompleted() || (update.reportsCompletion() && progress.isCompleted())) {
            runCompletionCascade(userId, course, progress, result.isCourseJustCompleted());
        }
        return result;
    }

    /**
     * Enroll the learner in every course of the path and create or refresh the path progress.
     */
    public PathProgress startPath(String userId, String pathId, EnrollmentOrigin origin) {
        LearningPath path = requirePath(pathId);
        EnrollmentOrigin effectiveOrigin = origin != null ? origin : EnrollmentOrigin.SELF_ENROLLED;

        for (String courseId : path.getCourseIds()) {
            EnrollmentResult enrollment = enrollmentService.enroll(userId, courseId, effectiveOrigin);
            if (enrollment.isCreated()) {
                eventPublisher.publish(LmsEvent.of(LmsEventType.ENROLLMENT_CREATED, userId, timeProvider.now())
                        .withCourseId(courseId)
                        .withPathId(pathId));
            }
        }

        PathProgressChange change = pathProgressService.recompute(userId, path, effectiveOrigin);
        PathProgress progress = change.getProgress();
        eventPublisher.publish(LmsEvent.of(LmsEventType.PATH_STARTED, userId, progress.getUpdatedAt())
                .withPathId(pathId)
                .withPercentComplete(progress.getPercentComplete()));
        if (change.isJustCompleted()) {
            onPathCompleted(userId, path, progress);
        }
        return progress;
    }

    /**
     * Sync the course index of a published path. Without course ids the catalog's course list is used.
     */
    public void publishPath(String pathId, List<String> courseIds) {
        List<String> effectiveCourseIds = courseIds;
        if (effectiveCourseIds == null) {
            effectiveCourseIds = requirePath(pathId).getCourseIds();
        }
        coursePathIndexService.syncForPublishedPath(pathId, effectiveCourseIds);
    }

    public CourseProgress getCourseProgress(String userId, String courseId) {
        CourseProgress progress = progressRepository.getCourseProgress(userId, courseId);
        if (progress == null) {
            throw new NotFoundException("No progress for course " + courseId);
        }
        return progress;
    }

    public PathProgress getPathProgress(String userId, String pathId) {
        PathProgress progress = progressRepository.getPathProgress(userId, pathId);
        if (progress == null) {
            throw new NotFoundException("No progress for path " + pathId);
        }
        return progress;
    }

    public List<IssuedCertificate> listCertificates(String userId, int limit) {
        int clamped = Math.max(1, Math.min(limit, LmsConfig.MAX_PAGE_SIZE));
        return certificateRepository.listIssuedCertificates(userId, clamped);
    }

    private void runCompletionCascade(String userId, Course course, CourseProgress progress, boolean justCompleted) {
        String courseId = course.getCourseId();
        if (justCompleted) {
            eventPublisher.publish(LmsEvent.of(LmsEventType.COURSE_COMPLETED, userId, progress.getCompletedAt())
                    .withCourseId(courseId)
                    .withPercentComplete(progress.getPercentComplete()));
        }

        awardCertificates(userId, CompletionType.COURSE, courseId, course.getTitle(), progress.getCompletedAt());

        List<String> pathIds;
        try {
            pathIds = coursePathIndexService.lookupPublishedPathIds(courseId, LmsConfig.MAX_PAGE_SIZE);
        } catch (RuntimeException e) {
            logger.error("Failed to look up paths containing course {} for user {}", courseId, userId, e);
            return;
        }

        for (String pathId : pathIds) {
            try {
                recomputeAffectedPath(userId, pathId);
            } catch (RuntimeException e) {
                logger.warn("Failed to recompute path {} for user {} after completing course {}", pathId, userId, courseId, e);
            }
        }
    }

    private void recomputeAffectedPath(String userId, String pathId) {
        LearningPath path = catalogRepository.getPublishedPath(pathId);
        if (path == null) {
            logger.warn("Path {} is indexed but not published, skipping recompute for user {}", pathId, userId);
            return;
        }

        PathProgressChange change = pathProgressService.recompute(userId, path, EnrollmentOrigin.SELF_ENROLLED);
        PathProgress progress = change.getProgress();
        eventPublisher.publish(LmsEvent.of(LmsEventType.PATH_PROGRESS_CHANGED, userId, progress.getUpdatedAt())
                .withPathId(pathId)
                .withPercentComplete(progress.getPercentComplete()));
        if (change.isJustCompleted()) {
            onPathCompleted(userId, path, progress);
        }
    }

    private void onPathCompleted(String userId, LearningPath path, PathProgress progress) {
        eventPublisher.publish(LmsEvent.of(LmsEventType.PATH_COMPLETED, userId, progress.getCompletedAt())
                .withPathId(path.getPathId())
                .withPercentComplete(progress.getPercentComplete()));
        awardCertificates(userId, CompletionType.PATH, path.getPathId(), path.getTitle(), progress.getCompletedAt());
    }

    private void awardCertificates(String userId, CompletionType completionType, String targetId, String title,
                                   Instant completedAt) {
        try {
            certificateAwardService.awardForCompletion(userId, completionType, targetId, title, completedAt);
        } catch (RuntimeException e) {
            logger.error("Failed to award {} certificates for {} to user {}", completionType.getValue(), targetId, userId, e);
        }
    }

    private Course requireCourse(String courseId) {
        if (courseId == null || courseId.isBlank()) {
            throw new IllegalArgumentException("course_id is required");
        }
        Course course = catalogRepository.getPublishedCourse(courseId);
        if (course == null) {
            throw new NotFoundException("Course not found: " + courseId);
        }
        return course;
    }

    private LearningPath requirePath(String pathId) {
        LearningPath path = catalogRepository.getPublishedPath(pathId);
        if (path == null) {
            throw new NotFoundException("Path not found: " + pathId);
        }
        return path;
    }
}
