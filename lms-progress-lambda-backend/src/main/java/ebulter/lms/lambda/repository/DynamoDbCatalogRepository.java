package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.Course;
import ebulter.lms.lambda.model.LearningPath;
import ebulter.lms.lambda.model.PathCourseRef;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.getBool;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.getInt;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.getString;
import static ebulter.lms.lambda.repository.DynamoDbAttributes.s;

public class DynamoDbCatalogRepository implements CatalogRepository {
    private static final String STATUS_PUBLISHED = "published";

    private final DynamoDbClient dynamoDb;
    private final String coursesTable;
    private final String pathsTable;

    public DynamoDbCatalogRepository(DynamoDbClient dynamoDb, String coursesTable, String pathsTable) {
        this.dynamoDb = dynamoDb;
        this.coursesTable = coursesTable;
        this.pathsTable = pathsTable;
    }

    @Override
    public Course getPublishedCourse(String courseId) {
        Map<String, AttributeValue> item = getItem(coursesTable, "course_id", courseId);
        if (item == null || !STATUS_PUBLISHED.equals(getString(item, "status"))) {
            return null;
        }
        return new Course(getString(item, "course_id"), getString(item, "title"), getString(item, "status"));
    }

    @Override
    public LearningPath getPublishedPath(String pathId) {
        Map<String, AttributeValue> item = getItem(pathsTable, "path_id", pathId);
        if (item == null || !STATUS_PUBLISHED.equals(getString(item, "status"))) {
            return null;
        }

        List<PathCourseRef> courses = new ArrayList<>();
        AttributeValue courseList = item.get("courses");
        if (courseList != null && courseList.hasL()) {
            int position = 0;
            for (AttributeValue entry : courseList.l()) {
                if (!entry.hasM()) {
                    continue;
                }
                Map<String, AttributeValue> ref = entry.m();
                courses.add(new PathCourseRef(
                        getString(ref, "course_id"),
                        getInt(ref, "order", position),
                        getBool(ref, "required", true)
                ));
                position++;
            }
        }
        // List.sort is stable, so refs without an explicit order keep their stored position
        courses.sort(Comparator.comparingInt(PathCourseRef::getOrder));

        return new LearningPath(getString(item, "path_id"), getString(item, "title"), getString(item, "status"), courses);
    }

    private Map<String, AttributeValue> getItem(String tableName, String keyName, String id) {
        GetItemRequest request = GetItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(keyName, s(id)))
                .build();

        GetItemResponse response = dynamoDb.getItem(request);
        if (!response.hasItem() || response.item().isEmpty()) {
            return null;
        }
        return response.item();
    }
}
