package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.CoursePathMapping;

import java.util.List;

/**
 * Storage for the course to published path reverse index
 */
public interface CoursePathIndexRepository {
    /**
     * Course ids currently mapped to the path
     */
    List<String> listCourseIdsForPath(String pathId);

    void upsertMapping(CoursePathMapping mapping);

    void deleteMapping(String courseId, String pathId);

    /**
     * Ids of published paths containing the course, read by course id (never a table scan)
     */
    List<String> listPublishedPathIdsForCourse(String courseId, int limit);
}
