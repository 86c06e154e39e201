package org.app.challenge.model;

import org.app.challenge.exception.ConfigException;

import java.util.Locale;

/**
 * OWASP Top 10 (2021) categories scenarios can be filed under.
 */
public enum OwaspCategory {
    A01("A01:2021", "Broken Access Control"),
    A02("A02:2021", "Cryptographic Failures"),
    A03("A03:2021", "Injection"),
    A04("A04:2021", "Insecure Design"),
    A05("A05:2021", "Security Misconfiguration"),
    A06("A06:2021", "Vulnerable and Outdated Components"),
    A07("A07:2021", "Identification and Authentication Failures"),
    A08("A08:2021", "Software and Data Integrity Failures"),
    A09("A09:2021", "Security Logging and Monitoring Failures"),
    A10("A10:2021", "Server-Side Request Forgery");

    private final String code;
    private final String title;

    OwaspCategory(String code, String title) {
        this.code = code;
        this.title = title;
    }

    public String getCode() { return code; }
    public String getTitle() { return title; }

    /**
     * Accepts either the full code ("A03:2021") or its short form ("A03"), case-insensitive.
     */
    public static OwaspCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ConfigException("OWASP category code must not be blank");
        }
        String c = code.trim().toUpperCase(Locale.ROOT);
        for (OwaspCategory cat : values()) {
            if (cat.code.equals(c) || cat.name().equals(c)) return cat;
        }
        throw new ConfigException("Unknown OWASP category: " + code);
    }
}
