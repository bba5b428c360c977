package com.mesh.registry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Informational lifecycle tag of a version record, independent of production state.
 * Transitions only move forward: active, deprecated, archived.
 */
public enum VersionStatus {
    ACTIVE("active"),
    DEPRECATED("deprecated"),
    ARCHIVED("archived");

    private final String code;

    VersionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean canMoveTo(VersionStatus target) {
        return target.ordinal() >= ordinal();
    }

    @JsonCreator
    public static VersionStatus from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VersionStatus s : values()) {
            if (s.code.equals(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + value + " (expected active, deprecated or archived)");
    }
}
