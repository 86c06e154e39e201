package org.app.challenge.config;

import lombok.Data;
import org.app.challenge.model.ScenarioDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bound from the {@code challenge.*} namespace of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "challenge")
public class ChallengeProperties {

    private Profile profile = new Profile();
    private List<ScenarioDefinition> scenarios = new ArrayList<>();
    private Hints hints = new Hints();
    private AntiCheat antiCheat = new AntiCheat();
    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Profile {
        /** Enablement profile names active in this deployment. */
        private List<String> active = new ArrayList<>();
    }

    @Data
    public static class Hints {
        private int attemptsPerHint = 3;
        private long secondsPerHint = 300;
        private long tickIntervalSeconds = 30;
    }

    @Data
    public static class AntiCheat {
        private int windowSize = 50;
        private Duration windowMaxAge = Duration.ofMinutes(30);
    }

    @Data
    public static class Broadcast {
        private int bufferSize = 256;
    }
}
