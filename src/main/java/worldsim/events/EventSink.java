package worldsim.events;

/**
 * Receiver of historical events produced by the engines.
 */
@FunctionalInterface
public interface EventSink {

    void publish(HistoricalEvent event);

    /**
     * Sink that drops everything. Used by callers that only want the return values.
     */
    EventSink DISCARD = event -> { };
}
