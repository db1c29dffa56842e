package ebulter.lms.lambda.model;

/**
 * Body of POST /api/v1/lms/progress
 */
public class ProgressRequest extends ProgressUpdate {
    private String courseId;

    public ProgressRequest() {
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }
}
