package ebulter.lms.lambda.model;

/**
 * One lesson progress report from a client. Every field except lessonId is optional.
 */
public class ProgressUpdate {
    private String lessonId;
    private Double positionMs;
    private Double percentComplete;
    private Boolean completed;

    public ProgressUpdate() {
    }

    public ProgressUpdate(String lessonId, Double positionMs, Double percentComplete, Boolean completed) {
        this.lessonId = lessonId;
        this.positionMs = positionMs;
        this.percentComplete = percentComplete;
        this.completed = completed;
    }

    public static ProgressUpdate percent(String lessonId, double percentComplete) {
        return new ProgressUpdate(lessonId, null, percentComplete, null);
    }

    public static ProgressUpdate completed(String lessonId) {
        return new ProgressUpdate(lessonId, null, null, Boolean.TRUE);
    }

    public String getLessonId() {
        return lessonId;
    }

    public void setLessonId(String lessonId) {
        this.lessonId = lessonId;
    }

    public Double getPositionMs() {
        return positionMs;
    }

    public void setPositionMs(Double positionMs) {
        this.positionMs = positionMs;
    }

    public Double getPercentComplete() {
        return percentComplete;
    }

    public void setPercentComplete(Double percentComplete) {
        this.percentComplete = percentComplete;
    }

    public Boolean getCompleted() {
        return completed;
    }

    public void setCompleted(Boolean completed) {
        this.completed = completed;
    }

    public boolean reportsCompletion() {
        return Boolean.TRUE.equals(completed);
    }
}
