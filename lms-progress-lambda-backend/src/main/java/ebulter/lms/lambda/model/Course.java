package ebulter.lms.lambda.model;

public class Course {
    private String courseId;
    private String title;
    private String status;

    public Course() {
    }

    public Course(String courseId, String title, String status) {
        this.courseId = courseId;
        this.title = title;
        this.status = status;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
