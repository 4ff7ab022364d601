package com.project.image.comparison.DTOs;

import java.util.Locale;

/** Alignment strategy requested by the caller. */
public enum AlignStrategy {
    AUTO, CENTER, FEATURE;

    public static AlignStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown alignment strategy '" + name + "', expected one of auto, center, feature");
        }
    }

    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
