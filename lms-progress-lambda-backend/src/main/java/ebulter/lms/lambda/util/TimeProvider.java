package ebulter.lms.lambda.util;

import java.time.Instant;

/**
 * Time provider interface for testability
 * Every "now" the engine stamps on a record comes from here
 */
public interface TimeProvider {
    /**
     * Returns the current time in milliseconds
     */
    long currentTimeMillis();

    /**
     * Returns the current time as an instant with millisecond precision
     */
    default Instant now() {
        return Instant.ofEpochMilli(currentTimeMillis());
    }
}
