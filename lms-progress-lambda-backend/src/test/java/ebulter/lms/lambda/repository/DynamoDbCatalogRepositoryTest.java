package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.LearningPath;
import ebulter.lms.lambda.model.PathCourseRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

import java.util.List;
import java.util.Map;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DynamoDbCatalogRepositoryTest {

    @Mock
    DynamoDbClient dynamoDbMock;

    private DynamoDbCatalogRepository repository() {
        return new DynamoDbCatalogRepository(dynamoDbMock, "lms-courses", "lms-paths");
    }

    private void returnItem(Map<String, AttributeValue> item) {
        when(dynamoDbMock.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().item(item).build());
    }

    @Test
    public void getPublishedCourse_DraftCourse_ShouldReturnNull() {
        returnItem(Map.of("course_id", s("course-1"), "title", s("Intro"), "status", s("draft")));

        assertNull(repository().getPublishedCourse("course-1"));
    }

    @Test
    public void getPublishedCourse_PublishedCourse_ShouldMapTitle() {
        returnItem(Map.of("course_id", s("course-1"), "title", s("Intro"), "status", s("published")));

        assertEquals("Intro", repository().getPublishedCourse("course-1").getTitle());
    }

    @Test
    public void getPublishedPath_ShouldOrderCoursesAndDefaultRequired() {
        AttributeValue courses = AttributeValue.builder().l(
                m(Map.of("course_id", s("c2"), "order", n(2))),
                m(Map.of("course_id", s("c1"), "order", n(1), "required", bool(false))),
                s("not-a-map")
        ).build();
        returnItem(Map.of("path_id", s("path-1"), "title", s("Foundations"), "status", s("published"), "courses", courses));

        LearningPath path = repository().getPublishedPath("path-1");

        assertEquals(List.of("c1", "c2"), path.getCourses().stream().map(PathCourseRef::getCourseId).toList());
        assertFalse(path.getCourses().get(0).isRequired());
        assertTrue(path.getCourses().get(1).isRequired());
    }

    @Test
    public void getPublishedPath_Missing_ShouldReturnNull() {
        when(dynamoDbMock.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertNull(repository().getPublishedPath("path-1"));
    }
}
