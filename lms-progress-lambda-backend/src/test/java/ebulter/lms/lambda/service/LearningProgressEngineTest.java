package ebulter.lms.lambda.service;

import ebulter.lms.lambda.event.BestEffortEventPublisher;
import ebulter.lms.lambda.event.LmsEvent;
import ebulter.lms.lambda.event.LmsEventPublisher;
import ebulter.lms.lambda.event.LmsEventType;
import ebulter.lms.lambda.exception.NotFoundException;
import ebulter.lms.lambda.model.*;
import ebulter.lms.lambda.repository.*;
import ebulter.lms.lambda.util.MockTimeProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class LearningProgressEngineTest {
    private static final String USER = "learner-1";

    @Mock
    CertificateRepository certificateRepositoryMock;

    @Mock
    CoursePathIndexRepository indexRepositoryMock;

    private InMemoryCatalogRepository catalogRepository;
    private InMemoryProgressRepository progressRepository;
    private InMemoryCoursePathIndexRepository indexRepository;
    private InMemoryCertificateRepository certificateRepository;
    private CapturingEventPublisher events;
    private MockTimeProvider timeProvider;
    private LearningProgressEngine engine;

    static class CapturingEventPublisher implements LmsEventPublisher {
        final List<LmsEvent> published = new ArrayList<>();

        @Override
        public void publish(LmsEvent event) {
            published.add(event);
        }

        List<LmsEventType> types() {
            return published.stream().map(LmsEvent::getEventType).toList();
        }

        long count(LmsEventType type) {
            return published.stream().filter(event -> event.getEventType() == type).count();
        }
    }

    @BeforeEach
    void setUp() {
        catalogRepository = new InMemoryCatalogRepository()
                .withCourse("course-1", "Intro to Java")
                .withCourse("course-2", "Collections")
                .withPath("path-1", "Java Foundations", "course-1", "course-2");
        progressRepository = new InMemoryProgressRepository();
        indexRepository = new InMemoryCoursePathIndexRepository();
        certificateRepository = new InMemoryCertificateRepository();
        events = new CapturingEventPublisher();
        timeProvider = new MockTimeProvider();
        engine = newEngine(certificateRepository, indexRepository, events);
    }

    private LearningProgressEngine newEngine(CertificateRepository certificates, CoursePathIndexRepository index,
                                             LmsEventPublisher publisher) {
        return new LearningProgressEngine(catalogRepository, progressRepository, index, certificates,
                userId -> "Ada Lovelace", publisher, timeProvider, 30_000);
    }

    private static CertificateTemplate template(String templateId, CompletionType appliesTo, String appliesToId) {
        return new CertificateTemplate(templateId, "Completion", "published", appliesTo, appliesToId);
    }

    @Test
    public void applyProgress_TwoLessonCourse_ShouldCompleteOnceAndStayCompleted() {
        certificateRepository.addTemplate(template("tpl-course", CompletionType.COURSE, "course-1"));
        engine.enroll(USER, "course-1", EnrollmentOrigin.SELF_ENROLLED);
        engine.applyProgress(USER, "course-1", ProgressUpdate.percent("lesson-2", 0));

        timeProvider.advanceSeconds(60);
        ProgressUpdateResult first = engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));
        assertEquals(50, first.getProgress().getPercentComplete());
        assertFalse(first.getProgress().isCompleted());
        assertEquals(0, certificateRepository.issuedCount());

        timeProvider.advanceSeconds(60);
        ProgressUpdateResult second = engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-2"));
        assertEquals(100, second.getProgress().getPercentComplete());
        assertTrue(second.getProgress().isCompleted());
        assertTrue(second.isCourseJustCompleted());
        IssuedCertificate certificate = engine.listCertificates(USER, 10).get(0);
        assertEquals("Intro to Java", certificate.getCertificateData().getCourseTitle());

        timeProvider.advanceSeconds(60);
        ProgressUpdateResult third = engine.applyProgress(USER, "course-1", ProgressUpdate.percent("lesson-1", 10));
        assertEquals(100, third.getProgress().getPercentComplete());
        assertTrue(third.getProgress().isCompleted());
        assertEquals(second.getProgress().getCompletedAt(), third.getProgress().getCompletedAt());
        assertEquals(List.of(certificate), engine.listCertificates(USER, 10));
        assertEquals(1, events.count(LmsEventType.COURSE_COMPLETED));
        assertEquals(1, events.count(LmsEventType.CERTIFICATE_ISSUED));
    }

    @Test
    public void enroll_ShouldPublishEnrollmentOnlyOnCreate() {
        EnrollmentResult first = engine.enroll(USER, "course-1", EnrollmentOrigin.ASSIGNED);
        timeProvider.advanceSeconds(10);
        EnrollmentResult second = engine.enroll(USER, "course-1", EnrollmentOrigin.SELF_ENROLLED);

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals(EnrollmentOrigin.ASSIGNED, second.getProgress().getEnrollmentOrigin());
        assertEquals(List.of(LmsEventType.ENROLLMENT_CREATED), events.types());
    }

    @Test
    public void applyProgress_FrequentUpdates_ShouldBeRateLimited() {
        engine.applyProgress(USER, "course-1", ProgressUpdate.percent("lesson-1", 10));
        timeProvider.advanceSeconds(5);
        engine.applyProgress(USER, "course-1", ProgressUpdate.percent("lesson-1", 20));
        timeProvider.advanceSeconds(30);
        engine.applyProgress(USER, "course-1", ProgressUpdate.percent("lesson-1", 30));

        assertEquals(2, events.count(LmsEventType.PROGRESS_UPDATED));
        assertEquals(30, engine.getCourseProgress(USER, "course-1").getPercentComplete());
    }

    @Nested
    class PathCascadeTests {
        @BeforeEach
        void publish() {
            engine.publishPath("path-1", null);
            certificateRepository.addTemplate(template("tpl-path", CompletionType.PATH, "path-1"));
        }

        @Test
        public void applyProgress_CompletingCourseInPath_ShouldRecomputePath() {
            engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));

            PathProgress pathProgress = engine.getPathProgress(USER, "path-1");
            assertEquals(1, pathProgress.getCompletedCourses());
            assertEquals(50, pathProgress.getPercentComplete());
            assertEquals(PathStatus.IN_PROGRESS, pathProgress.getStatus());
            assertEquals("course-2", pathProgress.getNextCourseId());
            assertEquals(EnrollmentOrigin.SELF_ENROLLED, pathProgress.getEnrollmentOrigin());
            assertEquals(1, events.count(LmsEventType.PATH_PROGRESS_CHANGED));
            assertEquals(0, events.count(LmsEventType.PATH_COMPLETED));
        }

        @Test
        public void applyProgress_CompletingLastCourse_ShouldCompletePathAndIssueCertificate() {
            engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));
            timeProvider.advanceSeconds(3600);
            engine.applyProgress(USER, "course-2", ProgressUpdate.completed("lesson-1"));

            PathProgress pathProgress = engine.getPathProgress(USER, "path-1");
            assertTrue(pathProgress.isCompleted());
            assertEquals(PathStatus.COMPLETED, pathProgress.getStatus());
            assertEquals(timeProvider.now(), pathProgress.getCompletedAt());
            assertEquals(1, events.count(LmsEventType.PATH_COMPLETED));

            List<IssuedCertificate> certificates = engine.listCertificates(USER, 10);
            assertEquals(1, certificates.size());
            assertEquals("path-1", certificates.get(0).getPathId());
            assertEquals("Java Foundations", certificates.get(0).getCertificateData().getPathTitle());
        }

        @Test
        public void applyProgress_RetriedFinalCompletion_ShouldRedriveCascadeWithoutDuplicates() {
            engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));
            engine.applyProgress(USER, "course-2", ProgressUpdate.completed("lesson-1"));
            timeProvider.advanceSeconds(60);
            ProgressUpdateResult retried = engine.applyProgress(USER, "course-2", ProgressUpdate.completed("lesson-1"));

            assertFalse(retried.isCourseJustCompleted());
            assertEquals(2, events.count(LmsEventType.COURSE_COMPLETED));
            assertEquals(1, events.count(LmsEventType.PATH_COMPLETED));
            assertEquals(3, events.count(LmsEventType.PATH_PROGRESS_CHANGED));
            assertEquals(1, certificateRepository.issuedCount());
        }

        @Test
        public void applyProgress_CourseRemovedFromPath_ShouldNotTouchPath() {
            engine.publishPath("path-1", List.of("course-2"));

            engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));

            assertThrows(NotFoundException.class, () -> engine.getPathProgress(USER, "path-1"));
        }

        @Test
        public void startPath_ShouldEnrollInEveryCourse() {
            PathProgress progress = engine.startPath(USER, "path-1", EnrollmentOrigin.ASSIGNED);

            assertEquals(EnrollmentOrigin.ASSIGNED, progress.getEnrollmentOrigin());
            assertEquals(PathStatus.NOT_STARTED, progress.getStatus());
            assertEquals("course-1", progress.getNextCourseId());
            assertEquals(EnrollmentOrigin.ASSIGNED, engine.getCourseProgress(USER, "course-2").getEnrollmentOrigin());
            assertEquals(2, events.count(LmsEventType.ENROLLMENT_CREATED));
            assertEquals(1, events.count(LmsEventType.PATH_STARTED));
        }

        @Test
        public void startPath_AllCoursesAlreadyCompleted_ShouldCompletePath() {
            engine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));
            engine.applyProgress(USER, "course-2", ProgressUpdate.completed("lesson-1"));
            events.published.clear();

            engine.startPath(USER, "path-1", null);

            assertEquals(List.of(LmsEventType.PATH_STARTED), events.types());
            assertEquals(1, certificateRepository.issuedCount());
        }
    }

    @Nested
    class BestEffortTests {
        @Test
        public void applyProgress_FailingPublisher_ShouldStillSaveProgress() {
            LmsEventPublisher failing = event -> {
                throw new IllegalStateException("stream down");
            };
            LearningProgressEngine failingEngine = newEngine(certificateRepository, indexRepository,
                    new BestEffortEventPublisher(List.of(failing, events)));

            ProgressUpdateResult result = failingEngine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));

            assertTrue(result.getProgress().isCompleted());
            assertTrue(progressRepository.getCourseProgress(USER, "course-1").isCompleted());
            assertTrue(events.count(LmsEventType.COURSE_COMPLETED) > 0);
        }

        @Test
        public void applyProgress_FailingTemplateLookup_ShouldStillSaveProgress() {
            when(certificateRepositoryMock.getPublishedTemplatesForTarget(any(), any()))
                    .thenThrow(new RuntimeException("throttled"));
            LearningProgressEngine failingEngine = newEngine(certificateRepositoryMock, indexRepository, events);

            ProgressUpdateResult result = failingEngine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));

            assertTrue(result.isCourseJustCompleted());
            assertTrue(progressRepository.getCourseProgress(USER, "course-1").isCompleted());
        }

        @Test
        public void applyProgress_FailingIndexLookup_ShouldStillSaveProgress() {
            when(indexRepositoryMock.listPublishedPathIdsForCourse(any(), anyInt()))
                    .thenThrow(new RuntimeException("index unavailable"));
            LearningProgressEngine failingEngine = newEngine(certificateRepository, indexRepositoryMock, events);

            ProgressUpdateResult result = failingEngine.applyProgress(USER, "course-1", ProgressUpdate.completed("lesson-1"));

            assertTrue(result.getProgress().isCompleted());
            assertEquals(1, events.count(LmsEventType.COURSE_COMPLETED));
        }
    }

    @Nested
    class ValidationTests {
        @Test
        public void enroll_UnknownCourse_ShouldThrowNotFound() {
            assertThrows(NotFoundException.class, () -> engine.enroll(USER, "missing", null));
            assertNull(progressRepository.getCourseProgress(USER, "missing"));
        }

        @Test
        public void applyProgress_BlankCourse_ShouldThrowIllegalArgument() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.applyProgress(USER, " ", ProgressUpdate.percent("lesson-1", 10)));
        }

        @Test
        public void applyProgress_MissingLesson_ShouldThrowBeforeWriting() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.applyProgress(USER, "course-1", new ProgressUpdate(null, 10.0, 10.0, null)));
            assertEquals(0, progressRepository.getCourseWrites());
        }

        @Test
        public void startPath_UnknownPath_ShouldThrowNotFound() {
            assertThrows(NotFoundException.class, () -> engine.startPath(USER, "missing", null));
        }

        @Test
        public void getCourseProgress_NotEnrolled_ShouldThrowNotFound() {
            assertThrows(NotFoundException.class, () -> engine.getCourseProgress(USER, "course-1"));
        }

        @Test
        public void listCertificates_LimitOutOfRange_ShouldBeClamped() {
            LearningProgressEngine mockedEngine = newEngine(certificateRepositoryMock, indexRepository, events);

            mockedEngine.listCertificates(USER, 0);
            mockedEngine.listCertificates(USER, 10_000);

            verify(certificateRepositoryMock).listIssuedCertificates(USER, 1);
            verify(certificateRepositoryMock).listIssuedCertificates(USER, 200);
        }
    }
}
