package ebulter.lms.lambda.model;

import java.util.Objects;

public class IssuedCopy {
    private String title;
    private String body;

    public IssuedCopy() {
    }

    public IssuedCopy(String title, String body) {
        this.title = title;
        this.body = body;
    }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        IssuedCopy that = (IssuedCopy) o;
        return Objects.equals(title, that.title) && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, body);
    }
}
