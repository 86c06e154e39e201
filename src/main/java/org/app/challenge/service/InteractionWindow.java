package org.app.challenge.service;

import org.app.challenge.model.InteractionEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded recent-history of interactions for one scenario. Evicts by count and by age; all access
 * is serialized on the window itself.
 */
final class InteractionWindow {

    private final int capacity;
    private final Duration maxAge;
    private final Deque<InteractionEvent> events = new ArrayDeque<>();

    InteractionWindow(int capacity, Duration maxAge) {
        this.capacity = capacity;
        this.maxAge = maxAge;
    }

    synchronized void append(InteractionEvent event) {
        events.addLast(event);
        while (events.size() > capacity) {
            events.removeFirst();
        }
        evictOlderThan(event.timestamp().minus(maxAge));
    }

    /**
     * Removes and returns everything retained within {@code maxAge} of {@code now}.
     */
    synchronized List<InteractionEvent> drain(Instant now) {
        evictOlderThan(now.minus(maxAge));
        List<InteractionEvent> out = new ArrayList<>(events);
        events.clear();
        return out;
    }

    synchronized List<InteractionEvent> snapshot() {
        return new ArrayList<>(events);
    }

    private void evictOlderThan(Instant cutoff) {
        while (!events.isEmpty() && events.peekFirst().timestamp().isBefore(cutoff)) {
            events.removeFirst();
        }
    }
}
