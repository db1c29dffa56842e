package ebulter.lms.lambda.model;

import java.time.Instant;

public class IssuedCertificate {
    public static final String ISSUED_BY_SYSTEM = "system";

    private String certificateId;       // Derived from learner, template and target
    private String userId;
    private String templateId;
    private Instant issuedAt;
    private String issuedBy;
    private CompletionType completionType;
    private String courseId;            // Set when completionType is COURSE
    private String pathId;              // Set when completionType is PATH
    private CertificateData certificateData;
    private Instant createdAt;

    public IssuedCertificate() {
    }

    public IssuedCertificate(String certificateId, String userId, String templateId, CompletionType completionType,
                             String targetId, CertificateData certificateData, Instant issuedAt) {
        this.certificateId = certificateId;
        this.userId = userId;
        this.templateId = templateId;
        this.completionType = completionType;
        if (completionType == CompletionType.COURSE) {
            this.courseId = targetId;
        } else {
            this.pathId = targetId;
        }
        this.certificateData = certificateData;
        this.issuedAt = issuedAt;
        this.createdAt = issuedAt;
        this.issuedBy = ISSUED_BY_SYSTEM;
    }

    public String getTargetId() {
        return completionType == CompletionType.COURSE ? courseId : pathId;
    }

    public String getCertificateId() { return certificateId; }
    public void setCertificateId(String certificateId) { this.certificateId = certificateId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }

    public Instant getIssuedAt() { return issuedAt; }
    public void setIssuedAt(Instant issuedAt) { this.issuedAt = issuedAt; }

    public String getIssuedBy() { return issuedBy; }
    public void setIssuedBy(String issuedBy) { this.issuedBy = issuedBy; }

    public CompletionType getCompletionType() { return completionType; }
    public void setCompletionType(CompletionType completionType) { this.completionType = completionType; }

    public String getCourseId() { return courseId; }
    public void setCourseId(String courseId) { this.courseId = courseId; }

    public String getPathId() { return pathId; }
    public void setPathId(String pathId) { this.pathId = pathId; }

    public CertificateData getCertificateData() { return certificateData; }
    public void setCertificateData(CertificateData certificateData) { this.certificateData = certificateData; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        IssuedCertificate that = (IssuedCertificate) o;
        return certificateId.equals(that.certificateId);
    }

    @Override
    public int hashCode() {
        return certificateId.hashCode();
    }
}
