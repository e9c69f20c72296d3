package worldsim.simulation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * FIFO of turn summaries capped at a fixed size; adding to a full history evicts exactly
 * the oldest entry.
 */
public class TurnHistory {

    private final int maxSize;
    private final Deque<TurnSummary> entries = new ArrayDeque<>();

    public TurnHistory(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("History size must be positive");
        }
        this.maxSize = maxSize;
    }

    public synchronized void add(TurnSummary summary) {
        entries.addLast(summary);
        while (entries.size() > maxSize) {
            entries.removeFirst();
        }
    }

    public synchronized List<TurnSummary> entries() {
        return List.copyOf(entries);
    }

    public synchronized Optional<TurnSummary> latest() {
        return Optional.ofNullable(entries.peekLast());
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
