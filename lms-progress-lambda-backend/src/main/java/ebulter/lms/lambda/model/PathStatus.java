package ebulter.lms.lambda.model;

import com.google.gson.annotations.SerializedName;

public enum PathStatus {
    @SerializedName("not_started")
    NOT_STARTED("not_started"),
    @SerializedName("in_progress")
    IN_PROGRESS("in_progress"),
    @SerializedName("completed")
    COMPLETED("completed");

    private final String value;

    PathStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PathStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NOT_STARTED;
        }
        for (PathStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown path status: " + value);
    }
}
