package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.CourseProgress;
import ebulter.lms.lambda.model.EnrollmentOrigin;
import ebulter.lms.lambda.model.LessonProgress;
import ebulter.lms.lambda.model.PathProgress;
import ebulter.lms.lambda.model.PathStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.*;

/**
 * Course and path progress in the progress table.
 * PK user_id, SK COURSE#{course_id} or PATH#{path_id}.
 */
public class DynamoDbProgressRepository implements ProgressRepository {
    private static final Logger logger = LoggerFactory.getLogger(DynamoDbProgressRepository.class);

    static final String COURSE_PREFIX = "COURSE#";
    static final String PATH_PREFIX = "PATH#";
    private static final String ENTITY_COURSE_PROGRESS = "lms_course_progress";
    private static final String ENTITY_PATH_PROGRESS = "lms_path_progress";

    private final DynamoDbClient dynamoDb;
    private final String tableName;
    private final ProgressItemMigrator migrator;

    public DynamoDbProgressRepository(DynamoDbClient dynamoDb, String tableName) {
        this(dynamoDb, tableName, new ProgressItemMigrator());
    }

    public DynamoDbProgressRepository(DynamoDbClient dynamoDb, String tableName, ProgressItemMigrator migrator) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
        this.migrator = migrator;
    }

    @Override
    public CourseProgress getCourseProgress(String userId, String courseId) {
        Map<String, AttributeValue> item = getItem(userId, COURSE_PREFIX + courseId);
        return item == null ? null : toCourseProgress(item);
    }

    @Override
    public boolean createCourseProgressIfAbsent(CourseProgress progress) {
        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(toItem(progress))
                .conditionExpression("attribute_not_exists(SK)")
                .build();
        try {
            dynamoDb.putItem(putItemRequest);
            return true;
        } catch (ConditionalCheckFailedException e) {
            logger.info("Course progress for user {} course {} already exists", progress.getUserId(), progress.getCourseId());
            return false;
        }
    }

    @Override
    public void saveCourseProgress(CourseProgress progress) {
        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(toItem(progress))
                .build();

        dynamoDb.putItem(putItemRequest);
    }

    @Override
    public void touchCourseProgress(String userId, String courseId, Instant accessedAt) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":accessedAt", s(accessedAt.toString()));

        UpdateItemRequest updateItemRequest = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(key(userId, COURSE_PREFIX + courseId))
                .updateExpression("SET last_accessed_at = :accessedAt, last_activity_at = :accessedAt")
                .conditionExpression("attribute_exists(SK)")
                .expressionAttributeValues(values)
                .build();
        try {
            dynamoDb.updateItem(updateItemRequest);
        } catch (ConditionalCheckFailedException e) {
            logger.warn("Course progress for user {} course {} disappeared before it could be touched", userId, courseId);
        }
    }

    @Override
    public PathProgress getPathProgress(String userId, String pathId) {
        Map<String, AttributeValue> item = getItem(userId, PATH_PREFIX + pathId);
        return item == null ? null : toPathProgress(item);
    }

    @Override
    public void savePathProgress(PathProgress progress) {
        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(toItem(progress))
                .build();

        dynamoDb.putItem(putItemRequest);
    }

    private Map<String, AttributeValue> getItem(String userId, String sortKey) {
        GetItemRequest getItemRequest = GetItemRequest.builder()
                .tableName(tableName)
                .key(key(userId, sortKey))
                .build();

        GetItemResponse response = dynamoDb.getItem(getItemRequest);
        if (!response.hasItem() || response.item().isEmpty()) {
            return null;
        }
        return migrator.migrate(response.item());
    }

    private static Map<String, AttributeValue> key(String userId, String sortKey) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("user_id", s(userId));
        key.put("SK", s(sortKey));
        return key;
    }

    Map<String, AttributeValue> toItem(CourseProgress progress) {
        Map<String, AttributeValue> item = key(progress.getUserId(), COURSE_PREFIX + progress.getCourseId());
        item.put("entity_type", s(ENTITY_COURSE_PROGRESS));
        item.put("course_id", s(progress.getCourseId()));
        item.put("enrollment_origin", s(progress.getEnrollmentOrigin().getValue()));
        putIfPresent(item, "enrolled_at", progress.getEnrolledAt());
        item.put("percent_complete", n(progress.getPercentComplete()));
        item.put("completed", bool(progress.isCompleted()));
        putIfPresent(item, "completed_at", progress.getCompletedAt());
        putIfPresent(item, "current_lesson_id", progress.getCurrentLessonId());
        putIfPresent(item, "last_position_ms", progress.getLastPositionMs());
        putIfPresent(item, "started_at", progress.getStartedAt());
        putIfPresent(item, "last_accessed_at", progress.getLastAccessedAt());
        // Sort key of the by-course GSI
        putIfPresent(item, "last_activity_at", progress.getLastAccessedAt());
        putIfPresent(item, "updated_at", progress.getUpdatedAt());
        item.put("schema_version", n(ProgressItemMigrator.CURRENT_SCHEMA_VERSION));

        Map<String, AttributeValue> lessons = new LinkedHashMap<>();
        progress.getLessonProgress().forEach((lessonId, lesson) -> lessons.put(lessonId, m(toLessonAttributes(lesson))));
        item.put("lesson_progress", m(lessons));
        return item;
    }

    private static Map<String, AttributeValue> toLessonAttributes(LessonProgress lesson) {
        Map<String, AttributeValue> attributes = new HashMap<>();
        attributes.put("lesson_id", s(lesson.getLessonId()));
        attributes.put("percent_complete", n(lesson.getPercentComplete()));
        attributes.put("completed", bool(lesson.isCompleted()));
        putIfPresent(attributes, "completed_at", lesson.getCompletedAt());
        putIfPresent(attributes, "current_position_ms", lesson.getCurrentPositionMs());
        putIfPresent(attributes, "started_at", lesson.getStartedAt());
        putIfPresent(attributes, "last_accessed_at", lesson.getLastAccessedAt());
        putIfPresent(attributes, "last_progress_event_at", lesson.getLastProgressEventAt());
        return attributes;
    }

    Map<String, AttributeValue> toItem(PathProgress progress) {
        Map<String, AttributeValue> item = key(progress.getUserId(), PATH_PREFIX + progress.getPathId());
        item.put("entity_type", s(ENTITY_PATH_PROGRESS));
        item.put("path_id", s(progress.getPathId()));
        item.put("enrollment_origin", s(progress.getEnrollmentOrigin().getValue()));
        putIfPresent(item, "enrolled_at", progress.getEnrolledAt());
        item.put("total_courses", n(progress.getTotalCourses()));
        item.put("completed_courses", n(progress.getCompletedCourses()));
        item.put("percent_complete", n(progress.getPercentComplete()));
        item.put("status", s(progress.getStatus().getValue()));
        item.put("completed", bool(progress.isCompleted()));
        putIfPresent(item, "completed_at", progress.getCompletedAt());
        putIfPresent(item, "next_course_id", progress.getNextCourseId());
        putIfPresent(item, "started_at", progress.getStartedAt());
        putIfPresent(item, "last_activity_at", progress.getLastActivityAt());
        putIfPresent(item, "updated_at", progress.getUpdatedAt());
        item.put("schema_version", n(ProgressItemMigrator.CURRENT_SCHEMA_VERSION));
        return item;
    }

    private static CourseProgress toCourseProgress(Map<String, AttributeValue> item) {
        CourseProgress progress = new CourseProgress();
        progress.setUserId(getString(item, "user_id"));
        progress.setCourseId(getString(item, "SK").substring(COURSE_PREFIX.length()));
        progress.setEnrollmentOrigin(EnrollmentOrigin.fromValue(getString(item, "enrollment_origin")));
        progress.setEnrolledAt(getInstant(item, "enrolled_at"));
        progress.setPercentComplete(getInt(item, "percent_complete", 0));
        progress.setCompleted(getBool(item, "completed", false));
        progress.setCompletedAt(getInstant(item, "completed_at"));
        progress.setCurrentLessonId(getString(item, "current_lesson_id"));
        progress.setLastPositionMs(getLong(item, "last_position_ms"));
        progress.setStartedAt(getInstant(item, "started_at"));
        progress.setLastAccessedAt(getInstant(item, "last_accessed_at"));
        progress.setUpdatedAt(getInstant(item, "updated_at"));

        Map<String, LessonProgress> lessons = new LinkedHashMap<>();
        getMap(item, "lesson_progress").forEach((lessonId, value) -> lessons.put(lessonId, toLessonProgress(lessonId, value.m())));
        progress.setLessonProgress(lessons);
        return progress;
    }

    private static LessonProgress toLessonProgress(String lessonId, Map<String, AttributeValue> attributes) {
        LessonProgress lesson = new LessonProgress(lessonId);
        lesson.setPercentComplete(getInt(attributes, "percent_complete", 0));
        lesson.setCompleted(getBool(attributes, "completed", false));
        lesson.setCompletedAt(getInstant(attributes, "completed_at"));
        lesson.setCurrentPositionMs(getLong(attributes, "current_position_ms"));
        lesson.setStartedAt(getInstant(attributes, "started_at"));
        lesson.setLastAccessedAt(getInstant(attributes, "last_accessed_at"));
        lesson.setLastProgressEventAt(getInstant(attributes, "last_progress_event_at"));
        return lesson;
    }

    private static PathProgress toPathProgress(Map<String, AttributeValue> item) {
        PathProgress progress = new PathProgress();
        progress.setUserId(getString(item, "user_id"));
        progress.setPathId(getString(item, "SK").substring(PATH_PREFIX.length()));
        progress.setEnrollmentOrigin(EnrollmentOrigin.fromValue(getString(item, "enrollment_origin")));
        progress.setEnrolledAt(getInstant(item, "enrolled_at"));
        progress.setTotalCourses(getInt(item, "total_courses", 0));
        progress.setCompletedCourses(getInt(item, "completed_courses", 0));
        progress.setPercentComplete(getInt(item, "percent_complete", 0));
        progress.setStatus(PathStatus.fromValue(getString(item, "status")));
        progress.setCompleted(progress.getStatus() == PathStatus.COMPLETED);
        progress.setCompletedAt(getInstant(item, "completed_at"));
        progress.setNextCourseId(getString(item, "next_course_id"));
        progress.setStartedAt(getInstant(item, "started_at"));
        progress.setLastActivityAt(getInstant(item, "last_activity_at"));
        progress.setUpdatedAt(getInstant(item, "updated_at"));
        return progress;
    }
}
