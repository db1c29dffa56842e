package ebulter.lms.lambda.model;

/**
 * Body of POST /api/v1/lms/enrollments and, without course id, of POST /api/v1/lms/paths/{pathId}/start
 */
public class EnrollmentRequest {
    private String courseId;
    private String enrollmentOrigin;    // Optional, defaults to self_enrolled

    public EnrollmentRequest() {
    }

    public EnrollmentRequest(String courseId, String enrollmentOrigin) {
        this.courseId = courseId;
        this.enrollmentOrigin = enrollmentOrigin;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public String getEnrollmentOrigin() {
        return enrollmentOrigin;
    }

    public void setEnrollmentOrigin(String enrollmentOrigin) {
        this.enrollmentOrigin = enrollmentOrigin;
    }
}
