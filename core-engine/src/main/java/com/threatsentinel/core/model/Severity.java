package com.threatsentinel.core.model;

import java.util.Locale;

/**
 * Severity of a detection or an aggregated risk score.
 *
 * <p>
 * Each level carries a fixed weight used by the risk scorer. Levels are
 * declared in ascending order so {@link #compareTo(Enum)} follows the weight.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(0.25),
    MEDIUM(0.5),
    HIGH(0.75),
    CRITICAL(1.0);

    private final double weight;

    Severity(double weight) {
        this.weight = weight;
    }

    /**
     * @return numeric weight in {@code (0, 1]}
     */
    public double weight() {
        return weight;
    }

    /**
     * @param other severity to compare with
     * @return {@code true} if this level is at least as severe as {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parse a severity name, ignoring case and surrounding whitespace.
     *
     * @param value severity name, e.g. {@code "high"}
     * @return the matching severity
     * @throws IllegalArgumentException if {@code value} is null or unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: LOW, MEDIUM, HIGH, CRITICAL", e);
        }
    }
}
