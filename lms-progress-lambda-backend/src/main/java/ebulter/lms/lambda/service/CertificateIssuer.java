package ebulter.lms.lambda.service;

import ebulter.lms.lambda.model.CertificateData;
import ebulter.lms.lambda.model.CertificateIssueResult;
import ebulter.lms.lambda.model.CompletionType;
import ebulter.lms.lambda.model.IssuedCertificate;
import ebulter.lms.lambda.repository.CertificateRepository;
import ebulter.lms.lambda.util.CertificateIds;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues at most one certificate per learner, template and target. The certificate data of the first
 * issuance is kept for good; later attempts return that record untouched.
 */
public class CertificateIssuer {
    private static final Logger logger = LoggerFactory.getLogger(CertificateIssuer.class);

    private final CertificateRepository certificateRepository;
    private final TimeProvider timeProvider;

    public CertificateIssuer(CertificateRepository certificateRepository, TimeProvider timeProvider) {
        this.certificateRepository = certificateRepository;
        this.timeProvider = timeProvider;
    }

    public CertificateIssueResult issue(String userId, String templateId, CompletionType completionType,
                                        String targetId, CertificateData data) {
        String certificateId = CertificateIds.derive(userId, templateId, completionType, targetId);

        IssuedCertificate existing = certificateRepository.getIssuedCertificate(userId, certificateId);
        if (existing != null) {
            logger.info("Certificate {} already issued to user {}", certificateId, userId);
            return new CertificateIssueResult(existing, false);
        }

        IssuedCertificate certificate = new IssuedCertificate(certificateId, userId, templateId, completionType,
                targetId, data, timeProvider.now());
        if (certificateRepository.createIfAbsent(certificate)) {
            logger.info("Issued certificate {} to user {} for {} {} (template {})",
                    certificateId, userId, completionType.getValue(), targetId, templateId);
            return new CertificateIssueResult(certificate, true);
        }

        IssuedCertificate winner = certificateRepository.getIssuedCertificate(userId, certificateId);
        if (winner == null) {
            throw new IllegalStateException("Certificate " + certificateId + " exists but could not be read");
        }
        return new CertificateIssueResult(winner, false);
    }
}
