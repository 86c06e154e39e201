package org.app.challenge.model;

import org.app.challenge.exception.ConfigException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Named configuration bundle active in a deployment (e.g. "docker", "heroku", "safety-mode").
 * Names are compared case-insensitively.
 */
public final class DeploymentProfile {

    private static final DeploymentProfile EMPTY = new DeploymentProfile(Set.of());

    private final Set<String> names;

    private DeploymentProfile(Set<String> names) {
        this.names = names;
    }

    public static DeploymentProfile empty() {
        return EMPTY;
    }

    public static DeploymentProfile of(String... names) {
        if (names == null) throw new ConfigException("Profile names must not be null");
        return of(Arrays.asList(names));
    }

    public static DeploymentProfile of(Collection<String> names) {
        if (names == null) throw new ConfigException("Profile names must not be null");
        Set<String> normalized = new LinkedHashSet<>();
        for (String n : names) {
            normalized.add(normalize(n));
        }
        return new DeploymentProfile(Collections.unmodifiableSet(normalized));
    }

    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("Profile name must not be blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public boolean includes(String name) {
        return name != null && names.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    public Set<String> getNames() { return names; }

    @Override
    public boolean equals(Object o) {
        return o instanceof DeploymentProfile other && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "DeploymentProfile" + names;
    }
}
