package ebulter.lms.lambda.model;

import java.time.Instant;
import java.util.Objects;

public class LessonProgress {
    private String lessonId;
    private int percentComplete;            // 0-100, always 100 once completed
    private boolean completed;              // Never reverts to false
    private Instant completedAt;            // Set once
    private Long currentPositionMs;         // Resume position
    private Instant startedAt;              // Set on first touch
    private Instant lastAccessedAt;
    private Instant lastProgressEventAt;    // Last time a progress event was flagged for emission

    public LessonProgress() {
    }

    public LessonProgress(String lessonId) {
        this.lessonId = lessonId;
    }

    public String getLessonId() {
        return lessonId;
    }

    public void setLessonId(String lessonId) {
        this.lessonId = lessonId;
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

    public Long getCurrentPositionMs() {
        return currentPositionMs;
    }

    public void setCurrentPositionMs(Long currentPositionMs) {
        this.currentPositionMs = currentPositionMs;
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

    public Instant getLastProgressEventAt() {
        return lastProgressEventAt;
    }

    public void setLastProgressEventAt(Instant lastProgressEventAt) {
        this.lastProgressEventAt = lastProgressEventAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        LessonProgress that = (LessonProgress) o;
        return percentComplete == that.percentComplete
                && completed == that.completed
                && Objects.equals(lessonId, that.lessonId)
                && Objects.equals(completedAt, that.completedAt)
                && Objects.equals(currentPositionMs, that.currentPositionMs)
                && Objects.equals(startedAt, that.startedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lessonId, percentComplete, completed, completedAt);
    }
}
