package ebulter.lms.lambda.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot printed on an issued certificate. Captured once at issuance and never rewritten.
 */
public class CertificateData {
    private String recipientName;
    private String courseTitle;
    private String pathTitle;
    private Instant completionDate;
    private String badgeText;
    private String signatoryName;
    private String signatoryTitle;
    private IssuedCopy issuedCopy;

    public CertificateData() {
    }

    public String getRecipientName() { return recipientName; }
    public void setRecipientName(String recipientName) { this.recipientName = recipientName; }

    public String getCourseTitle() { return courseTitle; }
    public void setCourseTitle(String courseTitle) { this.courseTitle = courseTitle; }

    public String getPathTitle() { return pathTitle; }
    public void setPathTitle(String pathTitle) { this.pathTitle = pathTitle; }

    public Instant getCompletionDate() { return completionDate; }
    public void setCompletionDate(Instant completionDate) { this.completionDate = completionDate; }

    public String getBadgeText() { return badgeText; }
    public void setBadgeText(String badgeText) { this.badgeText = badgeText; }

    public String getSignatoryName() { return signatoryName; }
    public void setSignatoryName(String signatoryName) { this.signatoryName = signatoryName; }

    public String getSignatoryTitle() { return signatoryTitle; }
    public void setSignatoryTitle(String signatoryTitle) { this.signatoryTitle = signatoryTitle; }

    public IssuedCopy getIssuedCopy() { return issuedCopy; }
    public void setIssuedCopy(IssuedCopy issuedCopy) { this.issuedCopy = issuedCopy; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        CertificateData that = (CertificateData) o;
        return Objects.equals(recipientName, that.recipientName)
                && Objects.equals(courseTitle, that.courseTitle)
                && Objects.equals(pathTitle, that.pathTitle)
                && Objects.equals(completionDate, that.completionDate)
                && Objects.equals(badgeText, that.badgeText)
                && Objects.equals(signatoryName, that.signatoryName)
                && Objects.equals(signatoryTitle, that.signatoryTitle)
                && Objects.equals(issuedCopy, that.issuedCopy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recipientName, courseTitle, pathTitle, completionDate, badgeText);
    }
}
