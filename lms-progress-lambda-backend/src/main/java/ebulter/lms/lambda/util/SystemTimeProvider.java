package ebulter.lms.lambda.util;

/**
 * Default implementation of TimeProvider using system time
 */
public class SystemTimeProvider implements TimeProvider {
    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
