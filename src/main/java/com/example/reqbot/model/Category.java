package com.example.reqbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The nine fixed requirement categories.
 */
public enum Category {
    FUNCTIONAL("Functional", "Core functionality and features"),
    SAFETY("Safety", "Safety-critical requirements"),
    PERFORMANCE("Performance", "Speed, efficiency and resource usage"),
    SECURITY("Security", "Authentication, encryption and access control"),
    INTERFACE("Interface", "User interface and API requirements"),
    DATA("Data", "Data management and storage"),
    COMPLIANCE("Compliance", "Regulatory and standards compliance"),
    DOCUMENTATION("Documentation", "Documentation requirements"),
    TESTING("Testing", "Test and verification requirements");

    private final String displayName;
    private final String description;

    Category(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /** Resolves a configuration key such as {@code "functional"}; unknown keys yield empty. */
    public static Optional<Category> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.name().equals(normalized))
                .findFirst();
    }
}
