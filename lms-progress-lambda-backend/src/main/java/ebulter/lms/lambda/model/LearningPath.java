package ebulter.lms.lambda.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog definition of a learning path: an ordered list of courses.
 */
public class LearningPath {
    private String pathId;
    private String title;
    private String status;
    private List<PathCourseRef> courses = new ArrayList<>();   // Sorted by order

    public LearningPath() {
    }

    public LearningPath(String pathId, String title, String status, List<PathCourseRef> courses) {
        this.pathId = pathId;
        this.title = title;
        this.status = status;
        setCourses(courses);
    }

    public String getPathId() {
        return pathId;
    }

    public void setPathId(String pathId) {
        this.pathId = pathId;
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

    public List<PathCourseRef> getCourses() {
        return courses;
    }

    public void setCourses(List<PathCourseRef> courses) {
        this.courses = courses != null ? courses : new ArrayList<>();
    }

    public List<String> getCourseIds() {
        return courses.stream().map(PathCourseRef::getCourseId).toList();
    }
}
