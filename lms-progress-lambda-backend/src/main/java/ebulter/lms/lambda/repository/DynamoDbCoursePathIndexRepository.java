package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.CoursePathMapping;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.getString;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.putIfPresent;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.s;

/**
 * Reverse index items live in the progress table under a system partition:
 * user_id = __SYSTEM__, SK = COURSEPATH#PATH#{path_id}#COURSE#{course_id}.
 * The by-path listing is a key condition query on that partition. The by-course lookup uses the sparse
 * CoursePathByCourseIndex GSI (course_path_course_id, path_id). Only published mapping items carry
 * course_path_course_id, so learner progress items and unpublished mappings never appear in it.
 */
public class DynamoDbCoursePathIndexRepository implements CoursePathIndexRepository {
    static final String SYSTEM_USER_ID = "__SYSTEM__";
    static final String ENTITY_TYPE = "lms_course_paths";
    static final String COURSE_INDEX = "CoursePathByCourseIndex";
    static final String COURSE_INDEX_KEY = "course_path_course_id";

    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public DynamoDbCoursePathIndexRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    @Override
    public List<String> listCourseIdsForPath(String pathId) {
        Map<String, AttributeValue> expressionAttributeValues = new HashMap<>();
        expressionAttributeValues.put(":systemUser", s(SYSTEM_USER_ID));
        expressionAttributeValues.put(":prefix", s(pathPrefix(pathId)));

        List<String> courseIds = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest.Builder requestBuilder = QueryRequest.builder()
                    .tableName(tableName)
                    .keyConditionExpression("user_id = :systemUser AND begins_with(SK, :prefix)")
                    .expressionAttributeValues(expressionAttributeValues);
            if (startKey != null) {
                requestBuilder.exclusiveStartKey(startKey);
            }

            QueryResponse response = dynamoDb.query(requestBuilder.build());
            response.items().stream()
                    .map(item -> getString(item, "course_id"))
                    .filter(courseId -> courseId != null)
                    .forEach(courseIds::add);
            startKey = nextStartKey(response);
        } while (startKey != null);

        return courseIds;
    }

    @Override
    public void upsertMapping(CoursePathMapping mapping) {
        Map<String, AttributeValue> item = key(mapping.getCourseId(), mapping.getPathId());
        item.put("entity_type", s(ENTITY_TYPE));
        item.put("course_id", s(mapping.getCourseId()));
        item.put("path_id", s(mapping.getPathId()));
        item.put("path_status", s(mapping.getPathStatus()));
        if (CoursePathMapping.STATUS_PUBLISHED.equals(mapping.getPathStatus())) {
            item.put(COURSE_INDEX_KEY, s(mapping.getCourseId()));
        }
        putIfPresent(item, "updated_at", mapping.getUpdatedAt());

        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build();

        dynamoDb.putItem(putItemRequest);
    }

    @Override
    public void deleteMapping(String courseId, String pathId) {
        DeleteItemRequest deleteRequest = DeleteItemRequest.builder()
                .tableName(tableName)
                .key(key(courseId, pathId))
                .build();

        dynamoDb.deleteItem(deleteRequest);
    }

    @Override
    public List<String> listPublishedPathIdsForCourse(String courseId, int limit) {
        QueryRequest queryRequest = QueryRequest.builder()
                .tableName(tableName)
                .indexName(COURSE_INDEX)
                .keyConditionExpression(COURSE_INDEX_KEY + " = :courseId")
                .expressionAttributeValues(Map.of(":courseId", s(courseId)))
                .limit(limit)
                .build();

        Set<String> pathIds = new LinkedHashSet<>();
        for (Map<String, AttributeValue> item : dynamoDb.query(queryRequest).items()) {
            String pathId = getString(item, "path_id");
            if (pathId != null && pathIds.size() < limit) {
                pathIds.add(pathId);
            }
        }
        return new ArrayList<>(pathIds);
    }

    private static String pathPrefix(String pathId) {
        return "COURSEPATH#PATH#" + pathId + "#COURSE#";
    }

    private static Map<String, AttributeValue> key(String courseId, String pathId) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("user_id", s(SYSTEM_USER_ID));
        key.put("SK", s(pathPrefix(pathId) + courseId));
        return key;
    }

    private static Map<String, AttributeValue> nextStartKey(QueryResponse response) {
        return response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey()
                : null;
    }
}
