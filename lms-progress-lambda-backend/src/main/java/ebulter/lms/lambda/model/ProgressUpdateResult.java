package ebulter.lms.lambda.model;

public class ProgressUpdateResult {
    private final CourseProgress progress;
    private final boolean shouldEmitEvent;       // Rate limited progress notification
    private final boolean lessonJustCompleted;
    private final boolean courseJustCompleted;

    public ProgressUpdateResult(CourseProgress progress, boolean shouldEmitEvent,
                                boolean lessonJustCompleted, boolean courseJustCompleted) {
        this.progress = progress;
        this.shouldEmitEvent = shouldEmitEvent;
        this.lessonJustCompleted = lessonJustCompleted;
        this.courseJustCompleted = courseJustCompleted;
    }

    public CourseProgress getProgress() {
        return progress;
    }

    public boolean shouldEmitEvent() {
        return shouldEmitEvent;
    }

    public boolean isLessonJustCompleted() {
        return lessonJustCompleted;
    }

    public boolean isCourseJustCompleted() {
        return courseJustCompleted;
    }
}
