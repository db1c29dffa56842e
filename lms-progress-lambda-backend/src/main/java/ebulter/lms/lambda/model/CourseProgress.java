package ebulter.lms.lambda.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Progress of one learner in one course. Owned by (userId, courseId).
 */
public class CourseProgress {
    private String userId;                          // Partition key
    private String courseId;
    private EnrollmentOrigin enrollmentOrigin;
    private Instant enrolledAt;
    private Map<String, LessonProgress> lessonProgress = new LinkedHashMap<>();
    private int percentComplete;                    // Mean of touched lesson percentages
    private boolean completed;                      // Monotonic
    private Instant completedAt;                    // Set once
    private String currentLessonId;
    private Long lastPositionMs;
    private Instant startedAt;                      // Set on first progress event
    private Instant lastAccessedAt;
    private Instant updatedAt;

    public CourseProgress() {
    }

    public CourseProgress(String userId, String courseId, EnrollmentOrigin enrollmentOrigin, Instant enrolledAt) {
        this.userId = userId;
        this.courseId = courseId;
        this.enrollmentOrigin = enrollmentOrigin;
        this.enrolledAt = enrolledAt;
        this.lastAccessedAt = enrolledAt;
        this.updatedAt = enrolledAt;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public EnrollmentOrigin getEnrollmentOrigin() {
        return enrollmentOrigin;
    }

    public void setEnrollmentOrigin(EnrollmentOrigin enrollmentOrigin) {
        this.enrollmentOrigin = enrollmentOrigin;
    }

    public Instant getEnrolledAt() {
        return enrolledAt;
    }

    public void setEnrolledAt(Instant enrolledAt) {
        this.enrolledAt = enrolledAt;
    }

    public Map<String, LessonProgress> getLessonProgress() {
        return lessonProgress;
    }

    public void setLessonProgress(Map<String, LessonProgress> lessonProgress) {
        this.lessonProgress = lessonProgress != null ? lessonProgress : new LinkedHashMap<>();
    }

    public int getPercentComplete() {
        return percentComplete;
    }

    public void setPercentComplete(int percentComplete) {
        this.percentComplete = percentComplete;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public String getCurrentLessonId() {
        return currentLessonId;
    }

    public void setCurrentLessonId(String currentLessonId) {
        this.currentLessonId = currentLessonId;
    }

    public Long getLastPositionMs() {
        return lastPositionMs;
    }

    public void setLastPositionMs(Long lastPositionMs) {
        this.lastPositionMs = lastPositionMs;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * A course counts as started once the learner has touched a lesson or made any progress.
     */
    public boolean isStarted() {
        return completed || percentComplete > 0 || startedAt != null || !lessonProgress.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        CourseProgress that = (CourseProgress) o;
        return userId.equals(that.userId) && courseId.equals(that.courseId);
    }

    @Override
    public int hashCode() {
        int result = userId.hashCode();
        result = 31 * result + courseId.hashCode();
        return result;
    }
}
