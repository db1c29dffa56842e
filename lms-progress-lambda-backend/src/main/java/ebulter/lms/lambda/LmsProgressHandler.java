package ebulter.lms.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import ebulter.lms.lambda.config.LmsConfig;
import ebulter.lms.lambda.event.BestEffortEventPublisher;
import ebulter.lms.lambda.event.DynamoDbLmsEventPublisher;
import ebulter.lms.lambda.event.LmsEventPublisher;
import ebulter.lms.lambda.event.LoggingLmsEventPublisher;
import ebulter.lms.lambda.exception.NotFoundException;
import ebulter.lms.lambda.model.*;
import ebulter.lms.lambda.repository.DynamoDbCatalogRepository;
import ebulter.lms.lambda.repository.DynamoDbCertificateRepository;
import ebulter.lms.lambda.repository.DynamoDbCoursePathIndexRepository;
import ebulter.lms.lambda.repository.DynamoDbProgressRepository;
import ebulter.lms.lambda.service.CognitoRecipientDirectory;
import ebulter.lms.lambda.service.LearningProgressEngine;
import ebulter.lms.lambda.service.RecipientDirectory;
import ebulter.lms.lambda.util.LmsJson;
import ebulter.lms.lambda.util.SystemTimeProvider;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class LmsProgressHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(LmsProgressHandler.class);

    private static final Gson gson = LmsJson.gson();
    private static final String ADMIN_GROUP = "ADMIN";

    private final LearningProgressEngine engine;

    public LmsProgressHandler() {
        this(createEngine(LmsConfig.fromEnvironment()));
    }

    public LmsProgressHandler(LearningProgressEngine engine) {
        this.engine = engine;
    }

    static LearningProgressEngine createEngine(LmsConfig config) {
        DynamoDbClient dynamoDb = DynamoDbClient.create();

        RecipientDirectory recipientDirectory;
        String userPoolId = config.getUserPoolId();
        if (userPoolId == null) {
            logger.warn("USER_POOL_ID environment variable not set. Certificates will show the learner id as recipient name.");
            recipientDirectory = RecipientDirectory.learnerId();
        } else {
            recipientDirectory = new CognitoRecipientDirectory(CognitoIdentityProviderClient.create(), userPoolId);
        }

        List<LmsEventPublisher> publishers = new ArrayList<>();
        publishers.add(new LoggingLmsEventPublisher());
        if (config.getEventsTable() != null) {
            publishers.add(new DynamoDbLmsEventPublisher(dynamoDb, config.getEventsTable()));
        }

        return new LearningProgressEngine(
                new DynamoDbCatalogRepository(dynamoDb, config.getCoursesTable(), config.getPathsTable()),
                new DynamoDbProgressRepository(dynamoDb, config.getProgressTable()),
                new DynamoDbCoursePathIndexRepository(dynamoDb, config.getProgressTable()),
                new DynamoDbCertificateRepository(dynamoDb, config.getCertificatesTable()),
                recipientDirectory,
                new BestEffortEventPublisher(publishers),
                new SystemTimeProvider(),
                config.getProgressEventIntervalMillis()
        );
    }

    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent event, Context context) {
        String requestId = getRequestId(event, context);
        try {
            String path = event.getPath();
            // Normalize path by removing duplicate slashes
            while (path.contains("//")) {
                path = path.replace("//", "/");
            }
            String httpMethod = event.getHttpMethod();

            logger.info("path={}, httpMethod={}, requestId={}", path, httpMethod, requestId);

            // Handle CORS preflight OPTIONS requests
            if ("OPTIONS".equals(httpMethod)) {
                return createOptionsResponse();
            }

            DecodedJWT jwt = decodeToken(event);
            String userId = extractUserId(jwt);
            if (userId == null) {
                return createErrorResponse(HttpStatus.SC_UNAUTHORIZED, "UNAUTHORIZED", "Authentication required", requestId);
            }

            if (path.equals("/api/v1/lms/enrollments") && "POST".equals(httpMethod)) {
                EnrollmentRequest request = parseBody(event, EnrollmentRequest.class);
                EnrollmentResult result = engine.enroll(userId, request.getCourseId(),
                        EnrollmentOrigin.fromValue(request.getEnrollmentOrigin()));
                return createResponse(result.isCreated() ? HttpStatus.SC_CREATED : HttpStatus.SC_OK, result.getProgress());
            } else if (path.equals("/api/v1/lms/progress") && "POST".equals(httpMethod)) {
                ProgressRequest request = parseBody(event, ProgressRequest.class);
                ProgressUpdateResult result = engine.applyProgress(userId, request.getCourseId(), request);

                Map<String, Object> response = new LinkedHashMap<>();
                response.put("progress", result.getProgress());
                response.put("lesson_completed", result.isLessonJustCompleted());
                response.put("course_completed", result.isCourseJustCompleted());
                return createResponse(HttpStatus.SC_OK, response);
            } else if (path.matches(".*/api/v1/lms/paths/[^/]+/start$") && "POST".equals(httpMethod)) {
                String pathId = pathSegment(path, 2);
                EnrollmentRequest request = parseOptionalBody(event, EnrollmentRequest.class);
                String origin = request != null ? request.getEnrollmentOrigin() : null;
                PathProgress progress = engine.startPath(userId, pathId, EnrollmentOrigin.fromValue(origin));
                return createResponse(HttpStatus.SC_OK, progress);
            } else if (path.matches(".*/api/v1/lms/courses/[^/]+/progress$") && "GET".equals(httpMethod)) {
                String courseId = pathSegment(path, 2);
                return createResponse(HttpStatus.SC_OK, engine.getCourseProgress(userId, courseId));
            } else if (path.matches(".*/api/v1/lms/paths/[^/]+/progress$") && "GET".equals(httpMethod)) {
                String pathId = pathSegment(path, 2);
                return createResponse(HttpStatus.SC_OK, engine.getPathProgress(userId, pathId));
            } else if (path.equals("/api/v1/lms/certificates") && "GET".equals(httpMethod)) {
                int limit = parseLimit(event.getQueryStringParameters());
                List<IssuedCertificate> certificates = engine.listCertificates(userId, limit);

                Map<String, Object> response = new LinkedHashMap<>();
                response.put("certificates", certificates);
                return createResponse(HttpStatus.SC_OK, response);
            } else if (path.matches(".*/api/v1/admin/lms/paths/[^/]+/publish$") && "POST".equals(httpMethod)) {
                if (!hasAdminRole(jwt)) {
                    return createErrorResponse(HttpStatus.SC_FORBIDDEN, "FORBIDDEN", "ADMIN role required", requestId);
                }
                String pathId = pathSegment(path, 2);
                PublishPathRequest request = parseOptionalBody(event, PublishPathRequest.class);
                engine.publishPath(pathId, request != null ? request.getCourseIds() : null);
                logger.info("Path {} published by {}", pathId, userId);

                APIGatewayProxyResponseEvent response = createBaseResponse();
                response.setStatusCode(HttpStatus.SC_NO_CONTENT);
                return response;
            } else {
                return createErrorResponse(HttpStatus.SC_NOT_FOUND, "NOT_FOUND", "Route not found", requestId);
            }
        } catch (NotFoundException e) {
            return createErrorResponse(HttpStatus.SC_NOT_FOUND, "NOT_FOUND", e.getMessage(), requestId);
        } catch (IllegalArgumentException | JsonParseException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return createErrorResponse(HttpStatus.SC_BAD_REQUEST, "VALIDATION_ERROR", e.getMessage(), requestId);
        } catch (Exception e) {
            logger.error("Error handling request", e);
            return createErrorResponse(HttpStatus.SC_INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", requestId);
        }
    }

    private static <T> T parseBody(APIGatewayProxyRequestEvent event, Class<T> type) {
        T body = parseOptionalBody(event, type);
        if (body == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return body;
    }

    private static <T> T parseOptionalBody(APIGatewayProxyRequestEvent event, Class<T> type) {
        String body = event.getBody();
        if (body == null || body.isBlank()) {
            return null;
        }
        return gson.fromJson(body, type);
    }

    /**
     * Segment counted from the end of the path, URL decoded
     */
    private static String pathSegment(String path, int positionFromEnd) {
        String[] pathParts = path.split("/");
        return URLDecoder.decode(pathParts[pathParts.length - positionFromEnd], StandardCharsets.UTF_8);
    }

    private static int parseLimit(Map<String, String> queryParams) {
        if (queryParams == null || queryParams.get("limit") == null) {
            return LmsConfig.MAX_PAGE_SIZE;
        }
        try {
            return Integer.parseInt(queryParams.get("limit"));
        } catch (NumberFormatException e) {
            logger.warn("Invalid limit parameter: {}", queryParams.get("limit"));
            return LmsConfig.MAX_PAGE_SIZE;
        }
    }

    private static String getRequestId(APIGatewayProxyRequestEvent event, Context context) {
        if (event.getRequestContext() != null && event.getRequestContext().getRequestId() != null) {
            return event.getRequestContext().getRequestId();
        }
        return context != null ? context.getAwsRequestId() : null;
    }

    private static APIGatewayProxyResponseEvent createResponse(int statusCode, Object body) {
        APIGatewayProxyResponseEvent response = createBaseResponse();
        response.setStatusCode(statusCode);
        response.setBody(gson.toJson(body));
        return response;
    }

    private static APIGatewayProxyResponseEvent createErrorResponse(int statusCode, String code, String message, String requestId) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("request_id", requestId);
        return createResponse(statusCode, body);
    }

    private static APIGatewayProxyResponseEvent createBaseResponse() {
        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Access-Control-Allow-Origin", "*");  // enable CORS
        response.setHeaders(headers);
        return response;
    }

    private static APIGatewayProxyResponseEvent createOptionsResponse() {
        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        response.setStatusCode(HttpStatus.SC_OK);
        Map<String, String> headers = new HashMap<>();
        headers.put("Access-Control-Allow-Origin", "*");
        headers.put("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        headers.put("Access-Control-Allow-Headers", "Content-Type, Authorization");
        headers.put("Access-Control-Max-Age", "300");
        response.setHeaders(headers);
        response.setBody("");
        return response;
    }

    private DecodedJWT decodeToken(APIGatewayProxyRequestEvent event) {
        Map<String, String> headers = event.getHeaders();
        if (headers == null) {
            return null;
        }

        // API Gateway may lowercase header names
        String authHeader = headers.get("authorization");
        if (authHeader == null) {
            authHeader = headers.get("Authorization");
        }
        if (authHeader == null || authHeader.isEmpty()) {
            return null;
        }

        String token = authHeader.startsWith("Bearer ") ? authHeader.substring(7) : authHeader;
        try {
            // Decode JWT (without verification - Cognito already verified it)
            return JWT.decode(token);
        } catch (Exception e) {
            logger.warn("Could not decode authorization token: {}", e.getMessage());
            return null;
        }
    }

    private String extractUserId(DecodedJWT jwt) {
        if (jwt == null) {
            return null;
        }
        // Access tokens carry "username", ID tokens "cognito:username"
        for (String claim : List.of("username", "cognito:username", "sub")) {
            String value = jwt.getClaim(claim).asString();
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private boolean hasAdminRole(DecodedJWT jwt) {
        List<String> groups = jwt.getClaim("cognito:groups").asList(String.class);
        logger.info("Checking ADMIN role. cognito:groups: {}", groups);
        return groups != null && groups.contains(ADMIN_GROUP);
    }
}
