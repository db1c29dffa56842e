package ebulter.lms.lambda.service;

import ebulter.lms.lambda.event.LmsEvent;
import ebulter.lms.lambda.event.LmsEventPublisher;
import ebulter.lms.lambda.event.LmsEventType;
import ebulter.lms.lambda.model.CertificateData;
import ebulter.lms.lambda.model.CertificateIssueResult;
import ebulter.lms.lambda.model.CertificateTemplate;
import ebulter.lms.lambda.model.CompletionType;
import ebulter.lms.lambda.repository.CertificateRepository;
import ebulter.lms.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Issues a certificate for every published template of a completed course or path.
 * Each template is issued independently; one failing template does not stop the others.
 */
public class CertificateAwardService {
    private static final Logger logger = LoggerFactory.getLogger(CertificateAwardService.class);

    private final CertificateRepository certificateRepository;
    private final CertificateIssuer certificateIssuer;
    private final RecipientDirectory recipientDirectory;
    private final LmsEventPublisher eventPublisher;
    private final TimeProvider timeProvider;

    public CertificateAwardService(CertificateRepository certificateRepository, CertificateIssuer certificateIssuer,
                                   RecipientDirectory recipientDirectory, LmsEventPublisher eventPublisher,
                                   TimeProvider timeProvider) {
        this.certificateRepository = certificateRepository;
        this.certificateIssuer = certificateIssuer;
        this.recipientDirectory = recipientDirectory;
        this.eventPublisher = eventPublisher;
        this.timeProvider = timeProvider;
    }

    public List<CertificateIssueResult> awardForCompletion(String userId, CompletionType completionType, String targetId,
                                                           String targetTitle, Instant completedAt) {
        List<CertificateTemplate> templates = certificateRepository.getPublishedTemplatesForTarget(completionType, targetId);
        if (templates.isEmpty()) {
            logger.info("No published certificate templates for {} {}", completionType.getValue(), targetId);
            return List.of();
        }

        String recipientName = recipientDirectory.resolveDisplayName(userId);
        List<CertificateIssueResult> results = new ArrayList<>();
        for (CertificateTemplate template : templates) {
            try {
                CertificateData data = buildCertificateData(template, completionType, recipientName, targetTitle,
                        completedAt != null ? completedAt : timeProvider.now());
                CertificateIssueResult result = certificateIssuer.issue(userId, template.getTemplateId(),
                        completionType, targetId, data);
                if (result.isNew()) {
                    LmsEvent event = LmsEvent.of(LmsEventType.CERTIFICATE_ISSUED, userId, result.getCertificate().getIssuedAt())
                            .withCertificateId(result.getCertificate().getCertificateId())
                            .withTemplateId(template.getTemplateId());
                    if (completionType == CompletionType.COURSE) {
                        event.withCourseId(targetId);
                    } else {
                        event.withPathId(targetId);
                    }
                    eventPublisher.publish(event);
                }
                results.add(result);
            } catch (RuntimeException e) {
                logger.error("Failed to issue certificate for template {} to user {} ({} {})",
                        template.getTemplateId(), userId, completionType.getValue(), targetId, e);
            }
        }
        return results;
    }

    static CertificateData buildCertificateData(CertificateTemplate template, CompletionType completionType,
                                                String recipientName, String targetTitle, Instant completionDate) {
        CertificateData data = new CertificateData();
        data.setRecipientName(recipientName);
        if (completionType == CompletionType.COURSE) {
            data.setCourseTitle(targetTitle);
        } else {
            data.setPathTitle(targetTitle);
        }
        data.setCompletionDate(completionDate);
        data.setBadgeText(template.getBadgeText());
        data.setSignatoryName(template.getSignatoryName());
        data.setSignatoryTitle(template.getSignatoryTitle());
        data.setIssuedCopy(template.getIssuedCopy());
        return data;
    }
}
