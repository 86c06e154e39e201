package org.app.challenge.event;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.app.challenge.exception.ConfigException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fan-out of challenge events to subscribers.
 * - publish never blocks: each subscriber owns a bounded buffer
 * - a subscriber whose buffer overflows is closed and removed
 * - push subscribers are drained by a dedicated task on the delivery executor
 */
@Slf4j
public class EventBroadcaster implements AutoCloseable {

    private static final Duration DRAIN_POLL = Duration.ofMillis(200);

    private final Set<BufferedSubscription> subscribers = ConcurrentHashMap.newKeySet();
    private final AtomicLong ids = new AtomicLong();
    private final int bufferSize;
    private final ExecutorService deliveryExecutor;
    private final Counter published;
    private final Counter dropped;
    private volatile boolean shutdown;

    public EventBroadcaster(int bufferSize, MeterRegistry meterRegistry) {
        if (bufferSize < 1) {
            throw new ConfigException("Broadcast buffer size must be positive, got " + bufferSize);
        }
        this.bufferSize = bufferSize;
        AtomicLong threads = new AtomicLong();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "challenge-events-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.published = meterRegistry.counter("challenge.broadcast.published");
        this.dropped = meterRegistry.counter("challenge.broadcast.dropped");
    }

    public void publish(ChallengeEvent event) {
        Objects.requireNonNull(event, "event");
        for (BufferedSubscription sub : subscribers) {
            if (!sub.offer(event)) {
                log.info("Dropping subscriber #{}: buffer of {} events overflowed", sub.id, bufferSize);
                dropped.increment();
                sub.close();
            }
        }
        published.increment();
    }

    /**
     * Opens a pull subscription.
     */
    public Subscription subscribe() {
        if (shutdown) throw new IllegalStateException("Broadcaster is shut down");
        BufferedSubscription sub = new BufferedSubscription(ids.incrementAndGet());
        subscribers.add(sub);
        log.debug("Subscriber #{} opened ({} active)", sub.id, subscribers.size());
        return sub;
    }

    /**
     * Opens a subscription whose events are handed to {@code listener} off the publishing thread.
     * A listener that throws closes its own subscription.
     */
    public Subscription subscribe(Consumer<ChallengeEvent> listener) {
        Objects.requireNonNull(listener, "listener");
        BufferedSubscription sub = (BufferedSubscription) subscribe();
        deliveryExecutor.execute(() -> drain(sub, listener));
        return sub;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void drain(BufferedSubscription sub, Consumer<ChallengeEvent> listener) {
        try {
            while (!sub.isClosed()) {
                Optional<ChallengeEvent> next = sub.poll(DRAIN_POLL);
                next.ifPresent(listener);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sub.close();
        } catch (RuntimeException e) {
            log.warn("Listener of subscriber #{} failed, closing it: {}", sub.id, e.getMessage());
            sub.close();
        }
    }

    @Override
    public void close() {
        shutdown = true;
        for (BufferedSubscription sub : new ArrayList<>(subscribers)) {
            sub.close();
        }
        deliveryExecutor.shutdownNow();
    }

    private final class BufferedSubscription implements Subscription {
        private final long id;
        private final BlockingQueue<ChallengeEvent> buffer = new ArrayBlockingQueue<>(bufferSize);
        private final List<Runnable> closeCallbacks = new ArrayList<>();
        private volatile boolean closed;

        private BufferedSubscription(long id) {
            this.id = id;
        }

        boolean offer(ChallengeEvent event) {
            return closed || buffer.offer(event);
        }

        @Override
        public Optional<ChallengeEvent> poll(Duration timeout) throws InterruptedException {
            if (closed) return Optional.ofNullable(buffer.poll());
            return Optional.ofNullable(buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public void onClose(Runnable callback) {
            boolean runNow;
            synchronized (this) {
                runNow = closed;
                if (!runNow) closeCallbacks.add(callback);
            }
            if (runNow) runCallback(callback);
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            List<Runnable> callbacks;
            synchronized (this) {
                if (closed) return;
                closed = true;
                callbacks = new ArrayList<>(closeCallbacks);
                closeCallbacks.clear();
            }
            subscribers.remove(this);
            callbacks.forEach(this::runCallback);
        }

        private void runCallback(Runnable callback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Close callback of subscriber #{} failed: {}", id, e.getMessage());
            }
        }
    }
}
