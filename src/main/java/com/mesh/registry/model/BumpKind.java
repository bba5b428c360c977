package com.mesh.registry.model;

import java.util.Locale;

public enum BumpKind {
    MAJOR,
    MINOR,
    PATCH;

    /** Null or blank means {@link #PATCH}. */
    public static BumpKind from(String value) {
        if (value == null || value.isBlank()) {
            return PATCH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown bump kind: " + value + " (expected major, minor or patch)", e);
        }
    }
}
