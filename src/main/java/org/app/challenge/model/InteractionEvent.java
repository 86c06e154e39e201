package org.app.challenge.model;

import java.time.Instant;

/**
 * An inbound request that touched a scenario. viaIntendedPath is false for direct or administrative
 * paths that bypass the scenario's attack surface.
 */
public record InteractionEvent(String scenarioKey, boolean viaIntendedPath, Instant timestamp) {
}
