package ebulter.lms.lambda.service;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.EnrollmentOrigin;
import ebulter.lms.lambda.model.LessonProgress;
import ebulter.lms.lambda.model.ProgressUpdate;
import ebulter.lms.lambda.model.ProgressUpdateResult;
import ebulter.lms.lambda.repository.InMemoryProgressRepository;
import ebulter.lms.lambda.util.MockTimeProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class ProgressUpdaterTest {
    private static final String USER = "learner-1";
    private static final String COURSE = "course-1";

    private InMemoryProgressRepository progressRepository;
    private MockTimeProvider timeProvider;
    private ProgressUpdater progressUpdater;

    @BeforeEach
    void setUp() {
        progressRepository = new InMemoryProgressRepository();
        timeProvider = new MockTimeProvider();
        EnrollmentService enrollmentService = new EnrollmentService(progressRepository, timeProvider);
        progressUpdater = new ProgressUpdater(progressRepository, enrollmentService, timeProvider, 30_000);
    }

    private ProgressUpdateResult apply(ProgressUpdate update) {
        return progressUpdater.applyProgress(USER, COURSE, update);
    }

    @Nested
    class LessonProgressTests {
        @Test
        public void applyProgress_WithoutEnrollment_ShouldCreateSelfEnrolledProgress() {
            ProgressUpdateResult result = apply(ProgressUpdate.percent("lesson-1", 40));

            CourseProgress stored = progressRepository.getCourseProgress(USER, COURSE);
            assertNotNull(stored);
            assertEquals(EnrollmentOrigin.SELF_ENROLLED, stored.getEnrollmentOrigin());
            assertEquals(40, stored.getLessonProgress().get("lesson-1").getPercentComplete());
            assertEquals(timeProvider.now(), stored.getLessonProgress().get("lesson-1").getStartedAt());
            assertEquals(timeProvider.now(), stored.getStartedAt());
            assertEquals("lesson-1", stored.getCurrentLessonId());
            assertEquals(40, result.getProgress().getPercentComplete());
        }

        @Test
        public void applyProgress_OutOfRangeValues_ShouldBeClamped() {
            apply(new ProgressUpdate("lesson-1", -500.0, -20.0, null));
            LessonProgress lesson = progressRepository.getCourseProgress(USER, COURSE).getLessonProgress().get("lesson-1");
            assertEquals(0, lesson.getPercentComplete());
            assertEquals(0L, lesson.getCurrentPositionMs());

            apply(ProgressUpdate.percent("lesson-2", 250));
            lesson = progressRepository.getCourseProgress(USER, COURSE).getLessonProgress().get("lesson-2");
            assertEquals(100, lesson.getPercentComplete());
            assertFalse(lesson.isCompleted());
        }

        @Test
        public void applyProgress_NaNPercent_ShouldKeepPreviousValue() {
            apply(ProgressUpdate.percent("lesson-1", 30));
            apply(new ProgressUpdate("lesson-1", null, Double.NaN, null));

            assertEquals(30, progressRepository.getCourseProgress(USER, COURSE).getLessonProgress().get("lesson-1").getPercentComplete());
        }

        @Test
        public void applyProgress_PositionOnly_ShouldRecordResumePosition() {
            apply(new ProgressUpdate("lesson-1", 42_000.0, null, null));

            CourseProgress stored = progressRepository.getCourseProgress(USER, COURSE);
            assertEquals(42_000L, stored.getLessonProgress().get("lesson-1").getCurrentPositionMs());
            assertEquals(42_000L, stored.getLastPositionMs());
            assertEquals(0, stored.getLessonProgress().get("lesson-1").getPercentComplete());
        }

        @Test
        public void applyProgress_FractionalPosition_ShouldRoundToWholeMilliseconds() {
            apply(new ProgressUpdate("lesson-1", 12345.678, null, null));
            assertEquals(12346L, progressRepository.getCourseProgress(USER, COURSE).getLastPositionMs());

            apply(new ProgressUpdate("lesson-1", Double.NaN, null, null));
            apply(new ProgressUpdate("lesson-1", Double.POSITIVE_INFINITY, null, null));
            CourseProgress stored = progressRepository.getCourseProgress(USER, COURSE);
            assertEquals(12346L, stored.getLastPositionMs());
            assertEquals(12346L, stored.getLessonProgress().get("lesson-1").getCurrentPositionMs());

            apply(new ProgressUpdate("lesson-1", 1e30, null, null));
            assertEquals(Long.MAX_VALUE, progressRepository.getCourseProgress(USER, COURSE).getLastPositionMs());
        }

        @Test
        public void applyProgress_StartedAt_ShouldBeSetOnFirstTouchOnly() {
            apply(ProgressUpdate.percent("lesson-1", 10));
            Instant firstTouch = timeProvider.now();
            timeProvider.advanceSeconds(120);
            apply(ProgressUpdate.percent("lesson-1", 20));

            LessonProgress lesson = progressRepository.getCourseProgress(USER, COURSE).getLessonProgress().get("lesson-1");
            assertEquals(firstTouch, lesson.getStartedAt());
            assertEquals(timeProvider.now(), lesson.getLastAccessedAt());
        }
    }

    @Nested
    class MonotonicCompletionTests {
        @Test
        public void applyProgress_CompletedFlag_ShouldForceHundredPercentAndFlagJustCompleted() {
            ProgressUpdateResult result = apply(new ProgressUpdate("lesson-1", null, 20.0, true));

            LessonProgress lesson = result.getProgress().getLessonProgress().get("lesson-1");
            assertTrue(lesson.isCompleted());
            assertEquals(100, lesson.getPercentComplete());
            assertEquals(timeProvider.now(), lesson.getCompletedAt());
            assertTrue(result.isLessonJustCompleted());
        }

        @Test
        public void applyProgress_AfterLessonCompleted_ShouldNeverGoBelowHundred() {
            apply(ProgressUpdate.completed("lesson-1"));
            Instant completedAt = timeProvider.now();
            timeProvider.advanceSeconds(60);

            ProgressUpdateResult lower = apply(new ProgressUpdate("lesson-1", null, 10.0, false));
            LessonProgress lesson = lower.getProgress().getLessonProgress().get("lesson-1");
            assertTrue(lesson.isCompleted());
            assertEquals(100, lesson.getPercentComplete());
            assertEquals(completedAt, lesson.getCompletedAt());
            assertFalse(lower.isLessonJustCompleted());

            timeProvider.advanceSeconds(60);
            ProgressUpdateResult repeated = apply(ProgressUpdate.completed("lesson-1"));
            assertFalse(repeated.isLessonJustCompleted());
            assertEquals(completedAt, repeated.getProgress().getLessonProgress().get("lesson-1").getCompletedAt());
        }

        @Test
        public void applyProgress_CoursePercent_ShouldBeMeanOfTouchedLessons() {
            apply(ProgressUpdate.percent("lesson-1", 50));
            ProgressUpdateResult result = apply(ProgressUpdate.completed("lesson-2"));

            assertEquals(75, result.getProgress().getPercentComplete());
            assertFalse(result.getProgress().isCompleted());
        }

        @Test
        public void applyProgress_AllTouchedLessonsComplete_ShouldCompleteCourseOnce() {
            apply(ProgressUpdate.completed("lesson-1"));
            timeProvider.advanceSeconds(5);
            ProgressUpdateResult result = apply(ProgressUpdate.completed("lesson-2"));
            Instant courseCompletedAt = timeProvider.now();

            assertTrue(result.isCourseJustCompleted());
            assertTrue(result.getProgress().isCompleted());
            assertEquals(100, result.getProgress().getPercentComplete());
            assertEquals(courseCompletedAt, result.getProgress().getCompletedAt());

            timeProvider.advanceSeconds(5);
            ProgressUpdateResult again = apply(ProgressUpdate.completed("lesson-2"));
            assertFalse(again.isCourseJustCompleted());
            assertEquals(courseCompletedAt, again.getProgress().getCompletedAt());
        }

        @Test
        public void applyProgress_NewLessonAfterCourseCompleted_ShouldKeepCourseAtHundred() {
            apply(ProgressUpdate.completed("lesson-1"));
            assertTrue(progressRepository.getCourseProgress(USER, COURSE).isCompleted());

            ProgressUpdateResult result = apply(ProgressUpdate.percent("lesson-new", 10));

            assertTrue(result.getProgress().isCompleted());
            assertEquals(100, result.getProgress().getPercentComplete());
            assertFalse(result.isCourseJustCompleted());
        }
    }

    @Nested
    class EventRateLimitTests {
        @Test
        public void applyProgress_FirstReport_ShouldEmit() {
            assertTrue(apply(ProgressUpdate.percent("lesson-1", 5)).shouldEmitEvent());
        }

        @Test
        public void applyProgress_WithinInterval_ShouldNotEmit() {
            apply(ProgressUpdate.percent("lesson-1", 5));
            timeProvider.advanceSeconds(10);

            assertFalse(apply(ProgressUpdate.percent("lesson-1", 10)).shouldEmitEvent());
        }

        @Test
        public void applyProgress_AfterInterval_ShouldEmitAgain() {
            apply(ProgressUpdate.percent("lesson-1", 5));
            timeProvider.advanceSeconds(10);
            apply(ProgressUpdate.percent("lesson-1", 10));
            timeProvider.advanceSeconds(20);

            assertTrue(apply(ProgressUpdate.percent("lesson-1", 15)).shouldEmitEvent());
        }

        @Test
        public void applyProgress_IntervalIsPerLesson() {
            apply(ProgressUpdate.percent("lesson-1", 5));
            timeProvider.advanceSeconds(1);

            assertTrue(apply(ProgressUpdate.percent("lesson-2", 5)).shouldEmitEvent());
        }

        @Test
        public void applyProgress_Completion_ShouldAlwaysEmit() {
            apply(ProgressUpdate.percent("lesson-1", 90));
            timeProvider.advanceSeconds(1);

            ProgressUpdateResult result = apply(ProgressUpdate.completed("lesson-1"));
            assertTrue(result.shouldEmitEvent());
            assertTrue(result.isLessonJustCompleted());
        }
    }

    @Test
    public void applyProgress_MissingLessonId_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> apply(ProgressUpdate.percent(" ", 10)));
        assertNull(progressRepository.getCourseProgress(USER, COURSE));
    }
}
