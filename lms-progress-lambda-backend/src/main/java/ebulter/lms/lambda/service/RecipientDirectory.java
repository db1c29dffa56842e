package ebulter.lms.lambda.service;

/**
 * Resolves the name printed on a learner's certificate
 */
public interface RecipientDirectory {
    String resolveDisplayName(String userId);

    /**
     * Directory that prints the learner id, for deployments without a user pool
     */
    static RecipientDirectory learnerId() {
        return userId -> userId;
    }
}
