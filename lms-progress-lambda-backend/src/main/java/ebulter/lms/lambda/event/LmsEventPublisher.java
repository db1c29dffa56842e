package ebulter.lms.lambda.event;

public interface LmsEventPublisher {
    void publish(LmsEvent event);
}
