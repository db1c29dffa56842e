package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.s;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class DynamoDbCertificateRepositoryTest {
    private static final String TABLE = "lms-certificates";

    @Mock
    DynamoDbClient dynamoDbMock;

    private DynamoDbCertificateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DynamoDbCertificateRepository(dynamoDbMock, TABLE);
    }

    private static IssuedCertificate certificate(String certificateId, Instant issuedAt) {
        CertificateData data = new CertificateData();
        data.setRecipientName("Ada Lovelace");
        data.setCourseTitle("Intro to Java");
        data.setIssuedCopy(new IssuedCopy("Certificate", "Well done"));
        return new IssuedCertificate(certificateId, "learner-1", "tpl-1", CompletionType.COURSE, "course-1", data, issuedAt);
    }

    @Test
    public void createIfAbsent_ShouldKeyOnCertificateId() {
        assertTrue(repository.createIfAbsent(certificate("cert_abc", Instant.parse("2024-03-01T09:00:00Z"))));

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbMock).putItem(captor.capture());
        PutItemRequest request = captor.getValue();
        assertEquals("attribute_not_exists(SK)", request.conditionExpression());
        assertEquals("ISSUED#learner-1", request.item().get("entity_type").s());
        assertEquals("CERT#cert_abc", request.item().get("SK").s());
        assertEquals("course", request.item().get("completion_type").s());
        assertEquals("Ada Lovelace", request.item().get("certificate_data").m().get("recipient_name").s());
    }

    @Test
    public void createIfAbsent_AlreadyIssued_ShouldReturnFalse() {
        when(dynamoDbMock.putItem(any(PutItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

        assertFalse(repository.createIfAbsent(certificate("cert_abc", Instant.now())));
    }

    @Test
    public void getIssuedCertificate_ShouldReadConsistentlyAndMapData() {
        IssuedCertificate stored = certificate("cert_abc", Instant.parse("2024-03-01T09:00:00Z"));
        when(dynamoDbMock.getItem(any(GetItemRequest.class)))
                .thenReturn(GetItemResponse.builder().item(repository.toItem(stored)).build());

        IssuedCertificate certificate = repository.getIssuedCertificate("learner-1", "cert_abc");

        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbMock).getItem(captor.capture());
        assertTrue(captor.getValue().consistentRead());
        assertEquals("cert_abc", certificate.getCertificateId());
        assertEquals("course-1", certificate.getCourseId());
        assertEquals(stored.getIssuedAt(), certificate.getIssuedAt());
        assertEquals("Intro to Java", certificate.getCertificateData().getCourseTitle());
        assertEquals("Well done", certificate.getCertificateData().getIssuedCopy().getBody());
    }

    @Test
    public void listIssuedCertificates_ShouldSortNewestFirstAndApplyLimit() {
        IssuedCertificate older = certificate("cert_old", Instant.parse("2024-01-01T00:00:00Z"));
        IssuedCertificate newer = certificate("cert_new", Instant.parse("2024-02-01T00:00:00Z"));
        IssuedCertificate newest = certificate("cert_newest", Instant.parse("2024-03-01T00:00:00Z"));
        when(dynamoDbMock.query(any(QueryRequest.class))).thenReturn(
                QueryResponse.builder()
                        .items(List.of(repository.toItem(older), repository.toItem(newest)))
                        .lastEvaluatedKey(Map.of("SK", s("CERT#cert_newest")))
                        .build(),
                QueryResponse.builder()
                        .items(List.of(repository.toItem(newer)))
                        .build());

        List<IssuedCertificate> certificates = repository.listIssuedCertificates("learner-1", 2);

        assertEquals(List.of("cert_newest", "cert_new"),
                certificates.stream().map(IssuedCertificate::getCertificateId).toList());
    }

    @Test
    public void getPublishedTemplatesForTarget_ShouldFilterByTarget() {
        when(dynamoDbMock.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
                .items(List.of(Map.of(
                        "entity_type", s("TEMPLATE"),
                        "SK", s("tpl-1"),
                        "status", s("published"),
                        "applies_to", s("path"),
                        "applies_to_id", s("path-1"),
                        "badge_text", s("Foundations"))))
                .build());

        List<CertificateTemplate> templates = repository.getPublishedTemplatesForTarget(CompletionType.PATH, "path-1");

        assertEquals(1, templates.size());
        assertEquals("tpl-1", templates.get(0).getTemplateId());
        assertEquals(CompletionType.PATH, templates.get(0).getAppliesTo());
        assertNull(templates.get(0).getIssuedCopy());

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbMock).query(captor.capture());
        Map<String, AttributeValue> values = captor.getValue().expressionAttributeValues();
        assertEquals("TEMPLATE", values.get(":entityType").s());
        assertEquals("path", values.get(":appliesTo").s());
        assertEquals("path-1", values.get(":appliesToId").s());
    }
}
