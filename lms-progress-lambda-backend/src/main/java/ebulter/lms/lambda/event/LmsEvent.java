package ebulter.lms.lambda.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound notification about a learner's progress. Ids that do not apply to the event type stay null.
 */
public class LmsEvent {
    private final String eventId;
    private final LmsEventType eventType;
    private final String userId;
    private final Instant occurredAt;
    private String courseId;
    private String lessonId;
    private String pathId;
    private String certificateId;
    private String templateId;
    private Integer percentComplete;

    public LmsEvent(String eventId, LmsEventType eventType, String userId, Instant occurredAt) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.userId = userId;
        this.occurredAt = occurredAt;
    }

    public static LmsEvent of(LmsEventType eventType, String userId, Instant occurredAt) {
        return new LmsEvent(UUID.randomUUID().toString(), eventType, userId, occurredAt);
    }

    public LmsEvent withCourseId(String courseId) {
        this.courseId = courseId;
        return this;
    }

    public LmsEvent withLessonId(String lessonId) {
        this.lessonId = lessonId;
        return this;
    }

    public LmsEvent withPathId(String pathId) {
        this.pathId = pathId;
        return this;
    }

    public LmsEvent withCertificateId(String certificateId) {
        this.certificateId = certificateId;
        return this;
    }

    public LmsEvent withTemplateId(String templateId) {
        this.templateId = templateId;
        return this;
    }

    public LmsEvent withPercentComplete(Integer percentComplete) {
        this.percentComplete = percentComplete;
        return this;
    }

    public String getEventId() {
        return eventId;
    }

    public LmsEventType getEventType() {
        return eventType;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getCourseId() {
        return courseId;
    }

    public String getLessonId() {
        return lessonId;
    }

    public String getPathId() {
        return pathId;
    }

    public String getCertificateId() {
        return certificateId;
    }

    public String getTemplateId() {
        return templateId;
    }

    public Integer getPercentComplete() {
        return percentComplete;
    }

    @Override
    public String toString() {
        return "LmsEvent{" +
                "eventType=" + eventType +
                ", userId='" + userId + '\'' +
                ", courseId='" + courseId + '\'' +
                ", pathId='" + pathId + '\'' +
                '}';
    }
}
