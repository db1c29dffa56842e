package ebulter.lms.lambda.util;

import ebulter.lms.lambda.model.CompletionType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class CertificateIds {
    private static final String PREFIX = "cert_";
    private static final int HASH_LENGTH = 16;

    private CertificateIds() {
    }

    /**
     * Deterministic certificate id: the same learner, template and target always map to the same id.
     */
    public static String derive(String userId, String templateId, CompletionType completionType, String targetId) {
        String idString = userId + "|" + templateId + "|" + completionType.getValue() + "|" + targetId;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(idString.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
