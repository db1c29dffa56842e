package ebulter.lms.lambda.model;

/**
 * Admin managed template. Only published templates are used for issuance.
 */
public class CertificateTemplate {
    private String templateId;
    private String name;
    private String status;              // draft | published | archived
    private CompletionType appliesTo;
    private String appliesToId;         // course_id or path_id
    private String badgeText;
    private String signatoryName;
    private String signatoryTitle;
    private IssuedCopy issuedCopy;

    public CertificateTemplate() {
    }

    public CertificateTemplate(String templateId, String name, String status, CompletionType appliesTo, String appliesToId) {
        this.templateId = templateId;
        this.name = name;
        this.status = status;
        this.appliesTo = appliesTo;
        this.appliesToId = appliesToId;
    }

    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public CompletionType getAppliesTo() { return appliesTo; }
    public void setAppliesTo(CompletionType appliesTo) { this.appliesTo = appliesTo; }

    public String getAppliesToId() { return appliesToId; }
    public void setAppliesToId(String appliesToId) { this.appliesToId = appliesToId; }

    public String getBadgeText() { return badgeText; }
    public void setBadgeText(String badgeText) { this.badgeText = badgeText; }

    public String getSignatoryName() { return signatoryName; }
    public void setSignatoryName(String signatoryName) { this.signatoryName = signatoryName; }

    public String getSignatoryTitle() { return signatoryTitle; }
    public void setSignatoryTitle(String signatoryTitle) { this.signatoryTitle = signatoryTitle; }

    public IssuedCopy getIssuedCopy() { return issuedCopy; }
    public void setIssuedCopy(IssuedCopy issuedCopy) { this.issuedCopy = issuedCopy; }
}
