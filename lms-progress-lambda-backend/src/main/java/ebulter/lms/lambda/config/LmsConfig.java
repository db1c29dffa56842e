package ebulter.lms.lambda.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Lambda configuration read from environment variables
 */
public class LmsConfig {
    private static final Logger logger = LoggerFactory.getLogger(LmsConfig.class);

    /** Ceiling for every paginated read. Callers can ask for less, never for more. */
    public static final int MAX_PAGE_SIZE = 200;

    private static final long DEFAULT_PROGRESS_EVENT_INTERVAL_SECONDS = 30;

    private final Map<String, String> env;

    public LmsConfig(Map<String, String> env) {
        this.env = env;
    }

    public static LmsConfig fromEnvironment() {
        return new LmsConfig(System.getenv());
    }

    public String getProgressTable() {
        return getOrDefault("LMS_PROGRESS_TABLE", "lms_progress");
    }

    public String getCertificatesTable() {
        return getOrDefault("LMS_CERTIFICATES_TABLE", "lms_certificates");
    }

    public String getCoursesTable() {
        return getOrDefault("LMS_COURSES_TABLE", "lms_courses");
    }

    public String getPathsTable() {
        return getOrDefault("LMS_PATHS_TABLE", "lms_paths");
    }

    /**
     * Table for outbound telemetry events, or null when events are only logged
     */
    public String getEventsTable() {
        return getOrDefault("LMS_EVENTS_TABLE", null);
    }

    public String getUserPoolId() {
        return getOrDefault("USER_POOL_ID", null);
    }

    public long getProgressEventIntervalMillis() {
        String value = env.get("PROGRESS_EVENT_INTERVAL_SECONDS");
        if (value == null || value.isBlank()) {
            return DEFAULT_PROGRESS_EVENT_INTERVAL_SECONDS * 1000;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            if (seconds < 0) {
                throw new NumberFormatException("negative interval");
            }
            return seconds * 1000;
        } catch (NumberFormatException e) {
            logger.warn("Invalid PROGRESS_EVENT_INTERVAL_SECONDS '{}', using {}s", value, DEFAULT_PROGRESS_EVENT_INTERVAL_SECONDS);
            return DEFAULT_PROGRESS_EVENT_INTERVAL_SECONDS * 1000;
        }
    }

    private String getOrDefault(String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
