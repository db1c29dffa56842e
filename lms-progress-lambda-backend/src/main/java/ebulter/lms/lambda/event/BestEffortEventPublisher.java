package ebulter.lms.lambda.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Publishes to every delegate. A failing delegate is logged and skipped, so publishing never throws.
 */
public class BestEffortEventPublisher implements LmsEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(BestEffortEventPublisher.class);

    private final List<LmsEventPublisher> delegates;

    public BestEffortEventPublisher(List<LmsEventPublisher> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void publish(LmsEvent event) {
        for (LmsEventPublisher delegate : delegates) {
            try {
                delegate.publish(event);
            } catch (RuntimeException e) {
                logger.warn("Failed to publish {} event {} via {}: {}", event.getEventType().getValue(),
                        event.getEventId(), delegate.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
