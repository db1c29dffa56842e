package ebulter.lms.lambda.model;

public class EnrollmentResult {
    private final CourseProgress progress;
    private final boolean created;      // False when the learner was already enrolled

    public EnrollmentResult(CourseProgress progress, boolean created) {
        this.progress = progress;
        this.created = created;
    }

    public CourseProgress getProgress() {
        return progress;
    }

    public boolean isCreated() {
        return created;
    }
}
