package org.app.challenge.exception;

/**
 * Thrown when a scenario key is not present in the registry.
 */
public class ScenarioNotFoundException extends RuntimeException {

    private final String scenarioKey;

    public ScenarioNotFoundException(String scenarioKey) {
        super("Scenario not found: " + scenarioKey);
        this.scenarioKey = scenarioKey;
    }

    public String getScenarioKey() {
        return scenarioKey;
    }
}
