package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.Course;
import ebulter.lms.lambda.model.LearningPath;

/**
 * Read only view of the course and path catalog. Only published entries are visible.
 */
public interface CatalogRepository {
    Course getPublishedCourse(String courseId);

    LearningPath getPublishedPath(String pathId);
}
