package org.app.challenge.service;

import org.app.challenge.model.DeploymentProfile;

/**
 * Supplies the deployment profile in force right now. Consulted on every call, never cached.
 */
public interface ActiveProfileSource {

    DeploymentProfile currentProfile();
}
