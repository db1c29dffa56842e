package ebulter.lms.lambda.service;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.EnrollmentOrigin;
import ebulter.lms.lambda.model.LessonProgress;
import ebulter.lms.lambda.model.ProgressUpdate;
import ebulter.lms.lambda.model.ProgressUpdateResult;
import ebulter.lms.lambda.repository.ProgressRepository;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Applies one lesson progress report to the learner's course progress.
 * <p>
 * Client telemetry is never rejected: percentages are clamped to [0, 100] and negative positions to 0.
 * Completion is monotonic on both the lesson and the course.
 */
public class ProgressUpdater {
    private static final Logger logger = LoggerFactory.getLogger(ProgressUpdater.class);

    private final ProgressRepository progressRepository;
    private final EnrollmentService enrollmentService;
    private final TimeProvider timeProvider;
    private final long progressEventIntervalMillis;

    public ProgressUpdater(ProgressRepository progressRepository, EnrollmentService enrollmentService,
                           TimeProvider timeProvider, long progressEventIntervalMillis) {
        this.progressRepository = progressRepository;
        this.enrollmentService = enrollmentService;
        this.timeProvider = timeProvider;
        this.progressEventIntervalMillis = progressEventIntervalMillis;
    }

    public ProgressUpdateResult applyProgress(String userId, String courseId, ProgressUpdate update) {
        String lessonId = update.getLessonId();
        if (lessonId == null || lessonId.isBlank()) {
            throw new IllegalArgumentException("lesson_id is required");
        }

        Instant now = timeProvider.now();
        CourseProgress progress = enrollmentService.getOrCreate(userId, courseId, EnrollmentOrigin.SELF_ENROLLED).getProgress();

        LessonProgress lesson = progress.getLessonProgress().get(lessonId);
        if (lesson == null) {
            lesson = new LessonProgress(lessonId);
            progress.getLessonProgress().put(lessonId, lesson);
        }
        if (lesson.getStartedAt() == null) {
            lesson.setStartedAt(now);
        }

        Integer percent = clampPercent(update.getPercentComplete());
        if (percent != null) {
            lesson.setPercentComplete(percent);
        }

        boolean lessonJustCompleted = false;
        if (lesson.isCompleted()) {
            lesson.setPercentComplete(100);
        } else if (update.reportsCompletion()) {
            lesson.setCompleted(true);
            lesson.setPercentComplete(100);
            lesson.setCompletedAt(now);
            lessonJustCompleted = true;
        }

        Long position = clampPosition(update.getPositionMs());
        if (position != null) {
            lesson.setCurrentPositionMs(position);
            progress.setLastPositionMs(position);
        }
        lesson.setLastAccessedAt(now);

        progress.setCurrentLessonId(lessonId);
        if (progress.getStartedAt() == null) {
            progress.setStartedAt(now);
        }
        progress.setLastAccessedAt(now);
        progress.setUpdatedAt(now);

        boolean courseJustCompleted = false;
        if (progress.isCompleted()) {
            progress.setPercentComplete(100);
        } else {
            progress.setPercentComplete(averageLessonPercent(progress));
            if (progress.getPercentComplete() == 100) {
                progress.setCompleted(true);
                progress.setCompletedAt(now);
                courseJustCompleted = true;
            }
        }

        boolean shouldEmitEvent = lessonJustCompleted
                || lesson.getLastProgressEventAt() == null
                || now.toEpochMilli() - lesson.getLastProgressEventAt().toEpochMilli() >= progressEventIntervalMillis;
        if (shouldEmitEvent) {
            lesson.setLastProgressEventAt(now);
        }

        progressRepository.saveCourseProgress(progress);
        logger.info("Progress user={} course={} lesson={} lessonPercent={} coursePercent={} completed={}",
                userId, courseId, lessonId, lesson.getPercentComplete(), progress.getPercentComplete(), progress.isCompleted());

        return new ProgressUpdateResult(progress, shouldEmitEvent, lessonJustCompleted, courseJustCompleted);
    }

    /**
     * Mean over the lessons the learner has touched. Untouched lessons do not count as zero.
     */
    static int averageLessonPercent(CourseProgress progress) {
        if (progress.getLessonProgress().isEmpty()) {
            return 0;
        }
        double total = 0;
        for (LessonProgress lesson : progress.getLessonProgress().values()) {
            total += lesson.getPercentComplete();
        }
        return (int) Math.round(total / progress.getLessonProgress().size());
    }

    static Integer clampPercent(Double percent) {
        if (percent == null || percent.isNaN()) {
            return null;
        }
        return (int) Math.round(Math.max(0, Math.min(100, percent)));
    }

    /**
     * Players report fractional positions. Rounded to whole milliseconds, NaN and infinity are ignored.
     */
    static Long clampPosition(Double positionMs) {
        if (positionMs == null || positionMs.isNaN() || positionMs.isInfinite()) {
            return null;
        }
        // Math.round saturates at Long.MAX_VALUE
        return Math.max(0L, Math.round(positionMs));
    }
}
