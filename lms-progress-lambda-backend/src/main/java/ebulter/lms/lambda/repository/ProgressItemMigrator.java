package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.EnrollmentOrigin;
import ebulter.lms.lambda.model.PathStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.bool;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.m;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.n;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.s;

/**
 * Brings progress items written by older releases to the current layout.
 * Applied once to every item read from the progress table, before it is mapped to a typed record.
 */
public class ProgressItemMigrator {
    private static final Logger logger = LoggerFactory.getLogger(ProgressItemMigrator.class);

    public static final int CURRENT_SCHEMA_VERSION = 2;

    private static final String LEGACY_PERCENT = "progress_percent";
    private static final List<String> TIMESTAMP_FIELDS = List.of(
            "enrolled_at", "completed_at", "started_at", "last_accessed_at",
            "last_activity_at", "updated_at", "last_progress_event_at");

    public Map<String, AttributeValue> migrate(Map<String, AttributeValue> item) {
        Map<String, AttributeValue> migrated = normalizeProgressFields(item);
        String sortKey = DynamoDbAttributes.getString(migrated, "SK");

        if (sortKey != null && sortKey.startsWith(DynamoDbProgressRepository.COURSE_PREFIX)) {
            migrated.putIfAbsent("enrollment_origin", s(EnrollmentOrigin.SELF_ENROLLED.getValue()));
            Map<String, AttributeValue> lessons = new LinkedHashMap<>();
            DynamoDbAttributes.getMap(migrated, "lesson_progress").forEach((lessonId, value) -> {
                if (value.hasM()) {
                    Map<String, AttributeValue> lesson = normalizeProgressFields(value.m());
                    lesson.putIfAbsent("lesson_id", s(lessonId));
                    lessons.put(lessonId, m(lesson));
                } else {
                    logger.warn("Dropping malformed lesson progress entry {} in {}", lessonId, sortKey);
                }
            });
            migrated.put("lesson_progress", m(lessons));
            markFullCourseCompleted(migrated);
        } else if (sortKey != null && sortKey.startsWith(DynamoDbProgressRepository.PATH_PREFIX)) {
            migrated.putIfAbsent("status", s(PathStatus.NOT_STARTED.getValue()));
            migrated.putIfAbsent("total_courses", n(0));
            migrated.putIfAbsent("completed_courses", n(0));
        }

        migrated.put("schema_version", n(CURRENT_SCHEMA_VERSION));
        return migrated;
    }

    /**
     * Course completion is derived from percent_complete reaching 100. Lessons are left as reported.
     */
    private static void markFullCourseCompleted(Map<String, AttributeValue> course) {
        if (DynamoDbAttributes.getBool(course, "completed", false)
                || DynamoDbAttributes.getInt(course, "percent_complete", 0) < 100) {
            return;
        }
        course.put("completed", bool(true));
        if (!course.containsKey("completed_at")) {
            AttributeValue completedAt = course.containsKey("updated_at") ? course.get("updated_at") : course.get("last_accessed_at");
            if (completedAt != null) {
                course.put("completed_at", completedAt);
            }
        }
    }

    private Map<String, AttributeValue> normalizeProgressFields(Map<String, AttributeValue> source) {
        Map<String, AttributeValue> item = new HashMap<>(source);

        AttributeValue legacyPercent = item.remove(LEGACY_PERCENT);
        if (legacyPercent != null && !item.containsKey("percent_complete")) {
            item.put("percent_complete", legacyPercent);
        }

        for (String field : TIMESTAMP_FIELDS) {
            AttributeValue value = item.get(field);
            if (value == null) {
                continue;
            }
            if (Boolean.TRUE.equals(value.nul())) {
                item.remove(field);
            } else if (value.n() != null) {
                // Epoch milliseconds from the first schema
                item.put(field, s(Instant.ofEpochMilli(Long.parseLong(value.n())).toString()));
            }
        }

        if (DynamoDbAttributes.getLong(item, "percent_complete") == null) {
            item.put("percent_complete", n(0));
        }
        if (item.get("completed") == null || item.get("completed").bool() == null) {
            item.put("completed", bool(false));
        }

        // completed implies 100 percent
        if (DynamoDbAttributes.getBool(item, "completed", false)
                && DynamoDbAttributes.getInt(item, "percent_complete", 0) < 100) {
            item.put("percent_complete", n(100));
        }
        return item;
    }
}
