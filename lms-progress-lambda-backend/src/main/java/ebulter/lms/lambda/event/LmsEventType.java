package ebulter.lms.lambda.event;

import com.google.gson.annotations.SerializedName;

public enum LmsEventType {
    @SerializedName("lms_enrollment_created")
    ENROLLMENT_CREATED("lms_enrollment_created"),
    @SerializedName("lms_progress_updated")
    PROGRESS_UPDATED("lms_progress_updated"),
    @SerializedName("lms_lesson_completed")
    LESSON_COMPLETED("lms_lesson_completed"),
    @SerializedName("lms_course_completed")
    COURSE_COMPLETED("lms_course_completed"),
    @SerializedName("lms_path_started")
    PATH_STARTED("lms_path_started"),
    @SerializedName("lms_path_progress_changed")
    PATH_PROGRESS_CHANGED("lms_path_progress_changed"),
    @SerializedName("lms_path_completed")
    PATH_COMPLETED("lms_path_completed"),
    @SerializedName("lms_certificate_issued")
    CERTIFICATE_ISSUED("lms_certificate_issued");

    private final String value;

    LmsEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
