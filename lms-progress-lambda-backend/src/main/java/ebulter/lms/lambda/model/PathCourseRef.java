package ebulter.lms.lambda.model;

public class PathCourseRef {
    private String courseId;
    private int order;              // Position of the course within the path
    private boolean required = true;

    public PathCourseRef() {
    }

    public PathCourseRef(String courseId, int order, boolean required) {
        this.courseId = courseId;
        this.order = order;
        this.required = required;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public int getOrder() {
        return order;
    }

    public void setOrder(int order) {
        this.order = order;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }
}
