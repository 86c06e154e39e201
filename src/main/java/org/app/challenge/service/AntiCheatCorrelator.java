package org.app.challenge.service;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.exception.ConfigException;
import org.app.challenge.model.Classification;
import org.app.challenge.model.InteractionEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tags first solves as legitimate or suspect from the interactions that preceded them.
 * <p>
 * A solve is legitimate when the scenario's retained window holds at least one interaction that
 * went through the intended attack surface at or before the solve instant. Anything else,
 * including an empty window, is suspect. Classification only annotates a solve, it never blocks
 * or reverts one.
 */
@Slf4j
public class AntiCheatCorrelator {

    private final ScenarioRegistry registry;
    private final Clock clock;
    private final int windowSize;
    private final Duration windowMaxAge;
    private final Map<String, InteractionWindow> windows = new ConcurrentHashMap<>();

    public AntiCheatCorrelator(ScenarioRegistry registry, Clock clock, int windowSize, Duration windowMaxAge) {
        if (windowSize < 1) throw new ConfigException("Anti-cheat window size must be positive, got " + windowSize);
        if (windowMaxAge == null || windowMaxAge.isNegative() || windowMaxAge.isZero()) {
            throw new ConfigException("Anti-cheat window max age must be positive, got " + windowMaxAge);
        }
        this.registry = registry;
        this.clock = clock;
        this.windowSize = windowSize;
        this.windowMaxAge = windowMaxAge;
    }

    /**
     * Best-effort telemetry: interactions for unknown scenarios are dropped.
     */
    public void recordInteraction(String scenarioKey, boolean viaIntendedPath) {
        if (!registry.contains(scenarioKey)) {
            log.debug("Dropping interaction for unknown scenario '{}'", scenarioKey);
            return;
        }
        InteractionEvent event = new InteractionEvent(scenarioKey, viaIntendedPath, clock.instant());
        windows.computeIfAbsent(scenarioKey, k -> new InteractionWindow(windowSize, windowMaxAge)).append(event);
    }

    /**
     * Consumes the scenario's window and classifies the solve that happened at {@code solvedAt}.
     * Never throws: failures default to {@link Classification#SUSPECT}.
     */
    public Classification classifySolve(String scenarioKey, Instant solvedAt) {
        try {
            InteractionWindow window = windows.remove(scenarioKey);
            if (window == null) {
                log.debug("No interactions recorded before solve of '{}'", scenarioKey);
                return Classification.SUSPECT;
            }
            List<InteractionEvent> recent = window.drain(solvedAt);
            boolean intended = recent.stream()
                    .anyMatch(e -> e.viaIntendedPath() && !e.timestamp().isAfter(solvedAt));
            return intended ? Classification.LEGITIMATE : Classification.SUSPECT;
        } catch (RuntimeException e) {
            log.warn("Classification of '{}' failed, defaulting to SUSPECT: {}", scenarioKey, e.getMessage());
            return Classification.SUSPECT;
        }
    }

    /**
     * Read-only view of what is currently retained for a scenario.
     */
    public List<InteractionEvent> recentInteractions(String scenarioKey) {
        InteractionWindow window = windows.get(scenarioKey);
        return window == null ? List.of() : window.snapshot();
    }
}
