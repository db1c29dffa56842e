package ebulter.lms.lambda.repository;

import ebulter.lms.lambda.model.CertificateTemplate;
import ebulter.lms.lambda.model.CompletionType;
import ebulter.lms.lambda.model.IssuedCertificate;

import java.util.List;

public interface CertificateRepository {
    IssuedCertificate getIssuedCertificate(String userId, String certificateId);

    /**
     * Conditional create
     * @return false when a certificate with the same id already exists
     */
    boolean createIfAbsent(IssuedCertificate certificate);

    /**
     * Issued certificates of a learner, newest first
     */
    List<IssuedCertificate> listIssuedCertificates(String userId, int limit);

    List<CertificateTemplate> getPublishedTemplatesForTarget(CompletionType appliesTo, String appliesToId);
}
