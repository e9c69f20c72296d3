package worldsim.events;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Pending complex events ordered by priority, highest first. Events of equal priority
 * keep their submission order.
 */
public class EventQueue {

    private record Entry(ComplexEvent event, long sequence) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingDouble((Entry entry) -> entry.event().priority()).reversed()
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private long nextSequence = 0;

    public synchronized void submit(ComplexEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        queue.add(new Entry(event, nextSequence++));
    }

    /**
     * Removes and returns up to {@code max} events in priority order.
     */
    public synchronized List<ComplexEvent> drain(int max) {
        List<ComplexEvent> drawn = new ArrayList<>(Math.min(max, queue.size()));
        while (drawn.size() < max && !queue.isEmpty()) {
            drawn.add(queue.poll().event());
        }
        return drawn;
    }

    public synchronized List<ComplexEvent> pending() {
        List<Entry> entries = new ArrayList<>(queue);
        entries.sort(ORDER);
        return entries.stream().map(Entry::event).toList();
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized void clear() {
        queue.clear();
    }
}
