package worldsim.events;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, append-only log of committed historical events.
 * <p>
 * Once the capacity is reached the oldest entry is evicted. Listeners are notified
 * synchronously after the append; a failing listener is logged and does not affect
 * the log or the other listeners.
 */
public class EventLog implements EventSink {

    public static final int DEFAULT_CAPACITY = 1000;

    private static final Logger logger = Logger.getLogger(EventLog.class.getName());

    private final int capacity;
    private final Deque<HistoricalEvent> events = new ArrayDeque<>();
    private final List<Consumer<HistoricalEvent>> listeners = new CopyOnWriteArrayList<>();

    public EventLog() {
        this(DEFAULT_CAPACITY);
    }

    public EventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event log capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void publish(HistoricalEvent event) {
        events.addLast(event);
        while (events.size() > capacity) {
            events.removeFirst();
        }
        for (Consumer<HistoricalEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Historical event listener failed for " + event.type().tag(), e);
            }
        }
    }

    public void addListener(Consumer<HistoricalEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<HistoricalEvent> listener) {
        listeners.remove(listener);
    }

    public synchronized List<HistoricalEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<HistoricalEvent> eventsOfType(HistoricalEventType type) {
        List<HistoricalEvent> matching = new ArrayList<>();
        for (HistoricalEvent event : events) {
            if (event.type() == type) {
                matching.add(event);
            }
        }
        return matching;
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        events.clear();
    }
}
