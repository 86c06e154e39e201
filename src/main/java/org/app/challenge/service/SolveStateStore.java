package org.app.challenge.service;

import org.app.challenge.exception.ScenarioNotFoundException;
import org.app.challenge.model.Classification;
import org.app.challenge.model.Scenario;
import org.app.challenge.model.SolveState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-scenario solve progress. Each scenario owns its own atomics, so work on one scenario never
 * contends with another. Mutators are package-private: only the evaluator and the hint tracker
 * write here.
 */
public class SolveStateStore {

    private final Map<String, Entry> entries;

    public SolveStateStore(ScenarioRegistry registry) {
        Map<String, Entry> m = new LinkedHashMap<>();
        for (Scenario s : registry.all()) {
            m.put(s.getKey(), new Entry());
        }
        this.entries = Collections.unmodifiableMap(m);
    }

    int recordAttempt(String key) {
        return entry(key).attempts.incrementAndGet();
    }

    /**
     * Single-winner solve transition. solvedAt doubles as the solved flag, so the timestamp is
     * written by the same compare-and-set that flips it and can never change afterwards.
     *
     * @return true only for the caller that performed the transition
     */
    boolean markSolved(String key, Instant solvedAt) {
        return entry(key).solvedAt.compareAndSet(null, solvedAt);
    }

    /**
     * Classification is assigned once, after the solve.
     */
    boolean classify(String key, Classification classification) {
        Entry e = entry(key);
        if (e.solvedAt.get() == null) return false;
        return e.classification.compareAndSet(Classification.UNCLASSIFIED, classification);
    }

    public boolean isSolved(String key) {
        return entry(key).solvedAt.get() != null;
    }

    public int attemptCount(String key) {
        return entry(key).attempts.get();
    }

    public SolveState snapshot(String key) {
        Entry e = entry(key);
        return new SolveState(key, e.solvedAt.get(), e.classification.get(), e.attempts.get());
    }

    private Entry entry(String key) {
        Entry e = key == null ? null : entries.get(key);
        if (e == null) throw new ScenarioNotFoundException(key);
        return e;
    }

    private static final class Entry {
        final AtomicReference<Instant> solvedAt = new AtomicReference<>();
        final AtomicReference<Classification> classification = new AtomicReference<>(Classification.UNCLASSIFIED);
        final AtomicInteger attempts = new AtomicInteger();
    }
}
