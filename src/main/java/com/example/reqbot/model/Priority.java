package com.example.reqbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Requirement priority tier. {@link #SECURITY} is an override, not a peer of the other tiers.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW,
    SECURITY;

    /** Lower-case wire value ({@code high|medium|low|security}). */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
