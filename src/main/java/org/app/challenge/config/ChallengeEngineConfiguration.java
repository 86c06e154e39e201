package org.app.challenge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.app.challenge.event.EventBroadcaster;
import org.app.challenge.model.DeploymentProfile;
import org.app.challenge.service.ActiveProfileSource;
import org.app.challenge.service.AntiCheatCorrelator;
import org.app.challenge.service.EnablementResolver;
import org.app.challenge.service.HintProgressionTracker;
import org.app.challenge.service.LoggingSolveRecordSink;
import org.app.challenge.service.ProgressReportService;
import org.app.challenge.service.ScenarioRegistry;
import org.app.challenge.service.SolveRecordSink;
import org.app.challenge.service.SolveStateStore;
import org.app.challenge.service.SwappableProfileSource;
import org.app.challenge.service.VerificationEvaluator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Assembles the engine from {@link ChallengeProperties}. The registry is built once here and
 * passed explicitly to every component; a malformed definition fails context startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ChallengeProperties.class)
public class ChallengeEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScenarioRegistry scenarioRegistry(ChallengeProperties properties) {
        return ScenarioRegistry.load(properties.getScenarios());
    }

    @Bean
    public SwappableProfileSource activeProfileSource(ChallengeProperties properties) {
        DeploymentProfile profile = DeploymentProfile.of(properties.getProfile().getActive());
        log.info("Active enablement profile: {}", profile);
        return new SwappableProfileSource(profile);
    }

    @Bean
    public SolveStateStore solveStateStore(ScenarioRegistry registry) {
        return new SolveStateStore(registry);
    }

    @Bean(destroyMethod = "close")
    public EventBroadcaster eventBroadcaster(ChallengeProperties properties, MeterRegistry meterRegistry) {
        return new EventBroadcaster(properties.getBroadcast().getBufferSize(), meterRegistry);
    }

    @Bean
    public AntiCheatCorrelator antiCheatCorrelator(ScenarioRegistry registry, Clock clock,
                                                   ChallengeProperties properties) {
        ChallengeProperties.AntiCheat ac = properties.getAntiCheat();
        return new AntiCheatCorrelator(registry, clock, ac.getWindowSize(), ac.getWindowMaxAge());
    }

    @Bean(destroyMethod = "close")
    public HintProgressionTracker hintProgressionTracker(ScenarioRegistry registry, EnablementResolver resolver,
                                                         ActiveProfileSource profileSource, SolveStateStore store,
                                                         EventBroadcaster broadcaster, Clock clock,
                                                         ChallengeProperties properties) {
        ChallengeProperties.Hints hints = properties.getHints();
        HintProgressionTracker tracker = new HintProgressionTracker(registry, resolver, profileSource, store,
                broadcaster, clock, hints.getAttemptsPerHint(), Duration.ofSeconds(hints.getSecondsPerHint()));
        tracker.start(Duration.ofSeconds(hints.getTickIntervalSeconds()));
        return tracker;
    }

    @Bean
    @ConditionalOnMissingBean
    public SolveRecordSink solveRecordSink() {
        return new LoggingSolveRecordSink();
    }

    @Bean
    public VerificationEvaluator verificationEvaluator(ScenarioRegistry registry, EnablementResolver resolver,
                                                       ActiveProfileSource profileSource, SolveStateStore store,
                                                       AntiCheatCorrelator correlator,
                                                       HintProgressionTracker hintTracker,
                                                       EventBroadcaster broadcaster, SolveRecordSink sink,
                                                       Clock clock, MeterRegistry meterRegistry) {
        return new VerificationEvaluator(registry, resolver, profileSource, store, correlator, hintTracker,
                broadcaster, sink, clock, meterRegistry);
    }

    @Bean
    public ProgressReportService progressReportService(ScenarioRegistry registry, EnablementResolver resolver,
                                                       ActiveProfileSource profileSource, SolveStateStore store,
                                                       ObjectMapper objectMapper, Clock clock) {
        return new ProgressReportService(registry, resolver, profileSource, store, objectMapper, clock);
    }
}
