package org.app.challenge.service;

import org.app.challenge.exception.ConfigException;
import org.app.challenge.model.DeploymentProfile;
import org.app.challenge.model.Scenario;
import org.springframework.stereotype.Component;

/**
 * Decides whether a scenario is live under a profile. Stateless; callers pass the profile that is
 * current at call time.
 */
@Component
public class EnablementResolver {

    public boolean isActive(Scenario scenario, DeploymentProfile profile) {
        if (scenario == null) throw new IllegalArgumentException("scenario must not be null");
        if (profile == null) throw new ConfigException("Active profile must not be null");
        for (String disabled : scenario.getDisabledIn()) {
            if (profile.includes(disabled)) return false;
        }
        return true;
    }
}
