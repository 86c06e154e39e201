package org.app.challenge.service;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.exception.ConfigException;
import org.app.challenge.model.DeploymentProfile;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Profile source seeded from configuration that test harnesses can swap at runtime.
 */
@Slf4j
public class SwappableProfileSource implements ActiveProfileSource {

    private final AtomicReference<DeploymentProfile> current;

    public SwappableProfileSource(DeploymentProfile initial) {
        if (initial == null) throw new ConfigException("Initial profile must not be null");
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public DeploymentProfile currentProfile() {
        return current.get();
    }

    public void swap(DeploymentProfile profile) {
        if (profile == null) throw new ConfigException("Profile must not be null");
        DeploymentProfile previous = current.getAndSet(profile);
        log.info("Active profile changed from {} to {}", previous, profile);
    }
}
