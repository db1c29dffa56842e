package ebulter.lms.lambda.event;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.HashMap;
import java.util.Map;

public class DynamoDbLmsEventPublisher implements LmsEventPublisher {
    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public DynamoDbLmsEventPublisher(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    @Override
    public void publish(LmsEvent event) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("event_id", AttributeValue.builder().s(event.getEventId()).build());
        item.put("event_type", AttributeValue.builder().s(event.getEventType().getValue()).build());
        item.put("user_id", AttributeValue.builder().s(event.getUserId()).build());
        item.put("occurred_at", AttributeValue.builder().s(event.getOccurredAt().toString()).build());
        putIfPresent(item, "course_id", event.getCourseId());
        putIfPresent(item, "lesson_id", event.getLessonId());
        putIfPresent(item, "path_id", event.getPathId());
        putIfPresent(item, "certificate_id", event.getCertificateId());
        putIfPresent(item, "template_id", event.getTemplateId());
        if (event.getPercentComplete() != null) {
            item.put("percent_complete", AttributeValue.builder().n(String.valueOf(event.getPercentComplete())).build());
        }

        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build();

        dynamoDb.putItem(putItemRequest);
    }

    private static void putIfPresent(Map<String, AttributeValue> item, String name, String value) {
        if (value != null) {
            item.put(name, AttributeValue.builder().s(value).build());
        }
    }
}
