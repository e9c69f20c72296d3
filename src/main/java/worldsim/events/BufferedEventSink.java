package worldsim.events;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the events of a turn that has not been committed yet.
 * The scheduler drains the buffer into the {@link EventLog} on commit and drops it on rejection.
 */
public final class BufferedEventSink implements EventSink {

    private final List<HistoricalEvent> pending = new ArrayList<>();

    @Override
    public void publish(HistoricalEvent event) {
        pending.add(event);
    }

    public List<HistoricalEvent> pending() {
        return List.copyOf(pending);
    }

    public int size() {
        return pending.size();
    }

    public void drainTo(EventSink target) {
        pending.forEach(target::publish);
        pending.clear();
    }
}
