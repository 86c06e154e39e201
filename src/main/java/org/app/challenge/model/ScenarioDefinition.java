package org.app.challenge.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw scenario entry as bound from configuration. Validated and frozen into a {@link Scenario}
 * by the registry.
 */
@Data
public class ScenarioDefinition {
    private String key;
    private String name;
    private String category;
    private String owasp;
    private Integer difficulty;
    private String description;
    private List<String> hints = new ArrayList<>();
    private List<String> disabledIn = new ArrayList<>();
}
