package ebulter.lms.lambda.model;

public class CertificateIssueResult {
    private final IssuedCertificate certificate;
    private final boolean isNew;

    public CertificateIssueResult(IssuedCertificate certificate, boolean isNew) {
        this.certificate = certificate;
        this.isNew = isNew;
    }

    public IssuedCertificate getCertificate() {
        return certificate;
    }

    public boolean isNew() {
        return isNew;
    }
}
