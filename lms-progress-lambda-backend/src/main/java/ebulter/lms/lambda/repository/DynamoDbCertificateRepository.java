package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.CertificateData;
import ebulter.lms.lambda.model.CertificateTemplate;
import ebulter.lms.lambda.model.CompletionType;
import ebulter.lms.lambda.model.IssuedCertificate;
import ebulter.lms.lambda.model.IssuedCopy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static ebulter.lms.lambda.repository.DynamoDbAttributes.*;

/**
 * Certificates table, PK entity_type, SK SK.
 * Templates: entity_type = TEMPLATE, SK = template_id.
 * Issued certificates: entity_type = ISSUED#{user_id}, SK = CERT#{certificate_id}.
 */
public class DynamoDbCertificateRepository implements CertificateRepository {
    private static final Logger logger = LoggerFactory.getLogger(DynamoDbCertificateRepository.class);

    static final String TEMPLATE_ENTITY_TYPE = "TEMPLATE";
    static final String ISSUED_PREFIX = "ISSUED#";
    static final String CERT_PREFIX = "CERT#";
    private static final String STATUS_PUBLISHED = "published";

    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public DynamoDbCertificateRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    @Override
    public IssuedCertificate getIssuedCertificate(String userId, String certificateId) {
        GetItemRequest request = GetItemRequest.builder()
                .tableName(tableName)
                .key(key(userId, certificateId))
                .consistentRead(true)
                .build();

        GetItemResponse response = dynamoDb.getItem(request);
        if (!response.hasItem() || response.item().isEmpty()) {
            return null;
        }
        return toIssuedCertificate(response.item());
    }

    @Override
    public boolean createIfAbsent(IssuedCertificate certificate) {
        PutItemRequest putItemRequest = PutItemRequest.builder()
                .tableName(tableName)
                .item(toItem(certificate))
                .conditionExpression("attribute_not_exists(SK)")
                .build();
        try {
            dynamoDb.putItem(putItemRequest);
            return true;
        } catch (ConditionalCheckFailedException e) {
            logger.info("Certificate {} for user {} was created concurrently", certificate.getCertificateId(), certificate.getUserId());
            return false;
        }
    }

    @Override
    public List<IssuedCertificate> listIssuedCertificates(String userId, int limit) {
        Map<String, AttributeValue> expressionAttributeValues = new HashMap<>();
        expressionAttributeValues.put(":entityType", s(ISSUED_PREFIX + userId));
        expressionAttributeValues.put(":prefix", s(CERT_PREFIX));

        List<IssuedCertificate> certificates = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest.Builder requestBuilder = QueryRequest.builder()
                    .tableName(tableName)
                    .keyConditionExpression("entity_type = :entityType AND begins_with(SK, :prefix)")
                    .expressionAttributeValues(expressionAttributeValues);
            if (startKey != null) {
                requestBuilder.exclusiveStartKey(startKey);
            }
            QueryResponse response = dynamoDb.query(requestBuilder.build());
            response.items().forEach(item -> certificates.add(toIssuedCertificate(item)));
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey()
                    : null;
        } while (startKey != null);

        return certificates.stream()
                .sorted(Comparator.comparing(IssuedCertificate::getIssuedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<CertificateTemplate> getPublishedTemplatesForTarget(CompletionType appliesTo, String appliesToId) {
        Map<String, AttributeValue> expressionAttributeValues = new HashMap<>();
        expressionAttributeValues.put(":entityType", s(TEMPLATE_ENTITY_TYPE));
        expressionAttributeValues.put(":status", s(STATUS_PUBLISHED));
        expressionAttributeValues.put(":appliesTo", s(appliesTo.getValue()));
        expressionAttributeValues.put(":appliesToId", s(appliesToId));

        List<CertificateTemplate> templates = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest.Builder requestBuilder = QueryRequest.builder()
                    .tableName(tableName)
                    .keyConditionExpression("entity_type = :entityType")
                    .filterExpression("#status = :status AND applies_to = :appliesTo AND applies_to_id = :appliesToId")
                    .expressionAttributeNames(Map.of("#status", "status"))
                    .expressionAttributeValues(expressionAttributeValues);
            if (startKey != null) {
                requestBuilder.exclusiveStartKey(startKey);
            }
            QueryResponse response = dynamoDb.query(requestBuilder.build());
            response.items().forEach(item -> templates.add(toTemplate(item)));
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey()
                    : null;
        } while (startKey != null);

        return templates;
    }

    private static Map<String, AttributeValue> key(String userId, String certificateId) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("entity_type", s(ISSUED_PREFIX + userId));
        key.put("SK", s(CERT_PREFIX + certificateId));
        return key;
    }

    Map<String, AttributeValue> toItem(IssuedCertificate certificate) {
        Map<String, AttributeValue> item = key(certificate.getUserId(), certificate.getCertificateId());
        item.put("certificate_id", s(certificate.getCertificateId()));
        item.put("user_id", s(certificate.getUserId()));
        item.put("template_id", s(certificate.getTemplateId()));
        putIfPresent(item, "issued_at", certificate.getIssuedAt());
        putIfPresent(item, "issued_by", certificate.getIssuedBy());
        item.put("completion_type", s(certificate.getCompletionType().getValue()));
        putIfPresent(item, "course_id", certificate.getCourseId());
        putIfPresent(item, "path_id", certificate.getPathId());
        putIfPresent(item, "created_at", certificate.getCreatedAt());
        if (certificate.getCertificateData() != null) {
            item.put("certificate_data", m(toDataAttributes(certificate.getCertificateData())));
        }
        return item;
    }

    private static Map<String, AttributeValue> toDataAttributes(CertificateData data) {
        Map<String, AttributeValue> attributes = new HashMap<>();
        putIfPresent(attributes, "recipient_name", data.getRecipientName());
        putIfPresent(attributes, "course_title", data.getCourseTitle());
        putIfPresent(attributes, "path_title", data.getPathTitle());
        putIfPresent(attributes, "completion_date", data.getCompletionDate());
        putIfPresent(attributes, "badge_text", data.getBadgeText());
        putIfPresent(attributes, "signatory_name", data.getSignatoryName());
        putIfPresent(attributes, "signatory_title", data.getSignatoryTitle());
        if (data.getIssuedCopy() != null) {
            attributes.put("issued_copy", m(toCopyAttributes(data.getIssuedCopy())));
        }
        return attributes;
    }

    private static Map<String, AttributeValue> toCopyAttributes(IssuedCopy copy) {
        Map<String, AttributeValue> attributes = new HashMap<>();
        putIfPresent(attributes, "title", copy.getTitle());
        putIfPresent(attributes, "body", copy.getBody());
        return attributes;
    }

    private static IssuedCertificate toIssuedCertificate(Map<String, AttributeValue> item) {
        IssuedCertificate certificate = new IssuedCertificate();
        certificate.setCertificateId(getString(item, "certificate_id"));
        certificate.setUserId(getString(item, "user_id"));
        certificate.setTemplateId(getString(item, "template_id"));
        certificate.setIssuedAt(getInstant(item, "issued_at"));
        certificate.setIssuedBy(getString(item, "issued_by"));
        certificate.setCompletionType(CompletionType.fromValue(getString(item, "completion_type")));
        certificate.setCourseId(getString(item, "course_id"));
        certificate.setPathId(getString(item, "path_id"));
        certificate.setCreatedAt(getInstant(item, "created_at"));

        Map<String, AttributeValue> dataAttributes = getMap(item, "certificate_data");
        if (!dataAttributes.isEmpty()) {
            CertificateData data = new CertificateData();
            data.setRecipientName(getString(dataAttributes, "recipient_name"));
            data.setCourseTitle(getString(dataAttributes, "course_title"));
            data.setPathTitle(getString(dataAttributes, "path_title"));
            data.setCompletionDate(getInstant(dataAttributes, "completion_date"));
            data.setBadgeText(getString(dataAttributes, "badge_text"));
            data.setSignatoryName(getString(dataAttributes, "signatory_name"));
            data.setSignatoryTitle(getString(dataAttributes, "signatory_title"));
            data.setIssuedCopy(toIssuedCopy(getMap(dataAttributes, "issued_copy")));
            certificate.setCertificateData(data);
        }
        return certificate;
    }

    private static CertificateTemplate toTemplate(Map<String, AttributeValue> item) {
        CertificateTemplate template = new CertificateTemplate();
        template.setTemplateId(getString(item, "template_id") != null ? getString(item, "template_id") : getString(item, "SK"));
        template.setName(getString(item, "name"));
        template.setStatus(getString(item, "status"));
        template.setAppliesTo(CompletionType.fromValue(getString(item, "applies_to")));
        template.setAppliesToId(getString(item, "applies_to_id"));
        template.setBadgeText(getString(item, "badge_text"));
        template.setSignatoryName(getString(item, "signatory_name"));
        template.setSignatoryTitle(getString(item, "signatory_title"));
        template.setIssuedCopy(toIssuedCopy(getMap(item, "issued_copy")));
        return template;
    }

    private static IssuedCopy toIssuedCopy(Map<String, AttributeValue> attributes) {
        if (attributes.isEmpty()) {
            return null;
        }
        return new IssuedCopy(getString(attributes, "title"), getString(attributes, "body"));
    }
}
