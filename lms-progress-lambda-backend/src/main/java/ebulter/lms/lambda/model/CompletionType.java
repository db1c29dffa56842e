package ebulter.lms.lambda.model;

import com.google.gson.annotations.SerializedName;

public enum CompletionType {
    @SerializedName("course")
    COURSE("course"),
    @SerializedName("path")
    PATH("path");

    private final String value;

    CompletionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CompletionType fromValue(String value) {
        for (CompletionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown completion type: " + value);
    }
}
