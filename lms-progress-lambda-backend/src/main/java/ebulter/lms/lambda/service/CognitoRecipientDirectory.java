package ebulter.lms.lambda.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminGetUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminGetUserResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AttributeType;

import java.util.List;

/**
 * Recipient names from the Cognito user pool: name, then given and family name, then email.
 * Falls back to the learner id when the user has none of these or cannot be read.
 */
public class CognitoRecipientDirectory implements RecipientDirectory {
    private static final Logger logger = LoggerFactory.getLogger(CognitoRecipientDirectory.class);

    private final CognitoIdentityProviderClient cognitoClient;
    private final String userPoolId;

    public CognitoRecipientDirectory(CognitoIdentityProviderClient cognitoClient, String userPoolId) {
        this.cognitoClient = cognitoClient;
        this.userPoolId = userPoolId;
    }

    @Override
    public String resolveDisplayName(String userId) {
        try {
            AdminGetUserRequest request = AdminGetUserRequest.builder()
                    .userPoolId(userPoolId)
                    .username(userId)
                    .build();

            AdminGetUserResponse response = cognitoClient.adminGetUser(request);
            List<AttributeType> attributes = response.userAttributes();

            String name = getUserAttribute(attributes, "name");
            if (name != null) {
                return name;
            }
            String givenName = getUserAttribute(attributes, "given_name");
            String familyName = getUserAttribute(attributes, "family_name");
            if (givenName != null || familyName != null) {
                return ((givenName != null ? givenName : "") + " " + (familyName != null ? familyName : "")).trim();
            }
            String email = getUserAttribute(attributes, "email");
            return email != null ? email : userId;
        } catch (Exception e) {
            logger.warn("Failed to resolve display name for user {}: {}", userId, e.getMessage());
            return userId;
        }
    }

    private String getUserAttribute(List<AttributeType> attributes, String attributeName) {
        return attributes.stream()
                .filter(attr -> attr.name().equals(attributeName))
                .map(AttributeType::value)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }
}
