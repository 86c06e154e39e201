package org.app.challenge.service;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.event.ChallengeEvent;
import org.app.challenge.event.EventBroadcaster;
import org.app.challenge.exception.ConfigException;
import org.app.challenge.model.HintState;
import org.app.challenge.model.Scenario;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reveals each scenario's hints progressively.
 * <p>
 * Hint {@code n} (1-based) unlocks once {@code attempts >= n * attemptsPerHint} or once
 * {@code n * secondsPerHint} have elapsed since the scenario was first seen active, whichever comes
 * first. A zero setting disables that trigger. The unlocked count is a high-water mark and never
 * shrinks. A solved scenario exposes all of its hints and emits no further unlock events.
 */
@Slf4j
public class HintProgressionTracker implements AutoCloseable {

    private final ScenarioRegistry registry;
    private final EnablementResolver resolver;
    private final ActiveProfileSource profileSource;
    private final SolveStateStore store;
    private final EventBroadcaster broadcaster;
    private final Clock clock;
    private final int attemptsPerHint;
    private final long secondsPerHint;
    private final Map<String, Progress> progress = new ConcurrentHashMap<>();
    private ScheduledExecutorService ticker;

    public HintProgressionTracker(ScenarioRegistry registry, EnablementResolver resolver,
                                  ActiveProfileSource profileSource, SolveStateStore store,
                                  EventBroadcaster broadcaster, Clock clock,
                                  int attemptsPerHint, Duration timePerHint) {
        if (attemptsPerHint < 0) {
            throw new ConfigException("attempts-per-hint must not be negative, got " + attemptsPerHint);
        }
        if (timePerHint == null || timePerHint.isNegative()) {
            throw new ConfigException("seconds-per-hint must not be negative, got " + timePerHint);
        }
        this.registry = registry;
        this.resolver = resolver;
        this.profileSource = profileSource;
        this.store = store;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.attemptsPerHint = attemptsPerHint;
        this.secondsPerHint = timePerHint.getSeconds();
    }

    /**
     * Starts periodic re-evaluation of time-based unlocks. Scenarios active now start their clocks
     * immediately.
     */
    public synchronized void start(Duration tickInterval) {
        if (ticker != null) return;
        tick();
        long seconds = Math.max(1, tickInterval.getSeconds());
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hint-ticker");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleAtFixedRate(this::tickSafely, seconds, seconds, TimeUnit.SECONDS);
        log.info("Hint ticker started, interval {}s", seconds);
    }

    /**
     * Counts an attempt that did not go through the evaluator (e.g. a failed exploit try).
     */
    public void recordAttempt(String scenarioKey) {
        Scenario s = registry.lookup(scenarioKey);
        store.recordAttempt(scenarioKey);
        advance(s);
    }

    /**
     * Hint texts currently visible for the scenario. The returned list is an immutable prefix of the
     * scenario's hints and can be iterated any number of times.
     */
    public List<String> unlockedHints(String scenarioKey) {
        Scenario s = registry.lookup(scenarioKey);
        List<String> hints = s.getHints();
        if (store.isSolved(scenarioKey)) return hints;
        return hints.subList(0, advance(s));
    }

    public HintState hintState(String scenarioKey) {
        Scenario s = registry.lookup(scenarioKey);
        int total = s.getHints().size();
        Progress p = progress.get(scenarioKey);
        if (store.isSolved(scenarioKey)) {
            return new HintState(scenarioKey, total, total, p == null ? null : p.lastUnlockAt);
        }
        if (p == null) return new HintState(scenarioKey, 0, total, null);
        return new HintState(scenarioKey, p.unlocked.get(), total, p.lastUnlockAt);
    }

    /**
     * Stops hint emission for a freshly solved scenario. Must run after the solve is recorded and
     * before SOLVED is published: an unlock already in flight finishes first, any later one sees
     * the scenario solved.
     */
    public void onSolved(String scenarioKey) {
        Progress p = progress.get(scenarioKey);
        if (p == null) return;
        synchronized (p) {
            p.stopped = true;
            p.unlocked.set(registry.lookup(scenarioKey).getHints().size());
        }
    }

    /**
     * Re-evaluates after an attempt the evaluator has already counted.
     */
    void onAttempt(Scenario scenario) {
        advance(scenario);
    }

    /**
     * Re-evaluates every active, unsolved scenario.
     */
    public void tick() {
        for (Scenario s : registry.all()) {
            if (!store.isSolved(s.getKey())) {
                advance(s);
            }
        }
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.warn("Hint tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return the unlocked count after this evaluation
     */
    private int advance(Scenario s) {
        String key = s.getKey();
        Progress p = progress.get(key);
        if (!resolver.isActive(s, profileSource.currentProfile())) {
            return p == null ? 0 : p.unlocked.get();
        }
        Instant now = clock.instant();
        if (p == null) {
            p = progress.computeIfAbsent(key, k -> new Progress(now));
        }
        int eligible = eligibleCount(s.getHints().size(), store.attemptCount(key),
                Duration.between(p.activeSince, now).getSeconds());
        synchronized (p) {
            int previous = p.unlocked.get();
            if (p.stopped || store.isSolved(key) || eligible <= previous) {
                return previous;
            }
            p.unlocked.set(eligible);
            p.lastUnlockAt = now;
            for (int i = previous; i < eligible; i++) {
                log.debug("Hint {} of '{}' unlocked", i + 1, key);
                broadcaster.publish(ChallengeEvent.hintUnlocked(key, now, i, s.getHints().get(i)));
            }
            return eligible;
        }
    }

    int eligibleCount(int totalHints, int attempts, long elapsedSeconds) {
        int count = 0;
        for (int n = 1; n <= totalHints; n++) {
            boolean byAttempts = attemptsPerHint > 0 && attempts >= (long) n * attemptsPerHint;
            boolean byTime = secondsPerHint > 0 && elapsedSeconds >= n * secondsPerHint;
            if (!byAttempts && !byTime) break;
            count = n;
        }
        return count;
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }
    }

    private static final class Progress {
        final Instant activeSince;
        final AtomicInteger unlocked = new AtomicInteger();
        volatile Instant lastUnlockAt;
        boolean stopped;

        Progress(Instant activeSince) {
            this.activeSince = activeSince;
        }
    }
}
