package ebulter.lms.lambda.model;

import com.google.gson.annotations.SerializedName;

public enum EnrollmentOrigin {
    @SerializedName("self_enrolled")
    SELF_ENROLLED("self_enrolled"),
    @SerializedName("assigned")
    ASSIGNED("assigned"),
    @SerializedName("required")
    REQUIRED("required"),
    @SerializedName("recommended")
    RECOMMENDED("recommended");

    private final String value;

    EnrollmentOrigin(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a stored or client supplied origin. A null or blank value means self enrolled.
     */
    public static EnrollmentOrigin fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SELF_ENROLLED;
        }
        for (EnrollmentOrigin origin : values()) {
            if (origin.value.equalsIgnoreCase(value.trim())) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown enrollment_origin: " + value);
    }
}
