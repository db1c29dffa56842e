package ebulter.lms.lambda.event;

import ebulter.lms.lambda.util.LmsJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as a single JSON line, picked up by CloudWatch Logs
 */
public class LoggingLmsEventPublisher implements LmsEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(LoggingLmsEventPublisher.class);

    @Override
    public void publish(LmsEvent event) {
        logger.info("EVENT: {}", LmsJson.gson().toJson(event));
    }
}
