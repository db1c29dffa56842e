package ebulter.lms.lambda.service;

import ebulter.lms.lambda.config.LmsConfig;
import ebulter.lms.lambda.model.CoursePathMapping;
import ebulter.lms.lambda.repository.CoursePathIndexRepository;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maintains the course to published path index used by the completion cascade.
 * <p>
 * The sync is a sequence of independent writes, not a transaction. A failure part way leaves the index
 * stale until the path is published again.
 */
public class CoursePathIndexService {
    private static final Logger logger = LoggerFactory.getLogger(CoursePathIndexService.class);

    private final CoursePathIndexRepository indexRepository;
    private final TimeProvider timeProvider;

    public CoursePathIndexService(CoursePathIndexRepository indexRepository, TimeProvider timeProvider) {
        this.indexRepository = indexRepository;
        this.timeProvider = timeProvider;
    }

    public void syncForPublishedPath(String pathId, List<String> courseIds) {
        Set<String> desired = new LinkedHashSet<>();
        if (courseIds != null) {
            for (String courseId : courseIds) {
                if (courseId != null && !courseId.isBlank()) {
                    desired.add(courseId);
                }
            }
        }

        List<String> previous = indexRepository.listCourseIdsForPath(pathId);
        int removed = 0;
        for (String courseId : previous) {
            if (!desired.contains(courseId)) {
                indexRepository.deleteMapping(courseId, pathId);
                removed++;
            }
        }

        Instant now = timeProvider.now();
        for (String courseId : desired) {
            indexRepository.upsertMapping(new CoursePathMapping(courseId, pathId, CoursePathMapping.STATUS_PUBLISHED, now));
        }

        logger.info("Synced course index for path {}: {} courses, {} removed", pathId, desired.size(), removed);
    }

    /**
     * Published paths containing the course. The limit is clamped to [1, {@link LmsConfig#MAX_PAGE_SIZE}].
     */
    public List<String> lookupPublishedPathIds(String courseId, int limit) {
        int clamped = Math.max(1, Math.min(limit, LmsConfig.MAX_PAGE_SIZE));
        return indexRepository.listPublishedPathIdsForCourse(courseId, clamped);
    }
}
