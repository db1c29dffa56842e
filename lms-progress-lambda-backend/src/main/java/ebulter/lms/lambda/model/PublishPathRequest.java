package ebulter.lms.lambda.model;

import java.util.List;

public class PublishPathRequest {
    private List<String> courseIds;     // Null means use the catalog's course list

    public PublishPathRequest() {
    }

    public List<String> getCourseIds() {
        return courseIds;
    }

    public void setCourseIds(List<String> courseIds) {
        this.courseIds = courseIds;
    }
}
