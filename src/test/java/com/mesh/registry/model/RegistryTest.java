package com.mesh.registry.model;

import com.mesh.registry.exception.ModelNotFoundException;
import com.mesh.registry.exception.VersionNotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RegistryTest {

    private static VersionRecord record(String model, String version) {
        return VersionRecord.builder()
                .modelName(model)
                .modelType("classification")
                .version(version)
                .createdAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    @Test
    void productionFlagFollowsThePointer() {
        Registry registry = new Registry();
        registry.append(record("m", "1.0.0"));
        registry.append(record("m", "1.0.1"));

        registry.pointProductionAt("m", "1.0.0");
        assertTrue(registry.require("m", "1.0.0").isProduction());
        assertFalse(registry.require("m", "1.0.1").isProduction());

        registry.pointProductionAt("m", "1.0.1");
        assertFalse(registry.require("m", "1.0.0").isProduction());
        assertTrue(registry.require("m", "1.0.1").isProduction());
        assertEquals(1, registry.line("m").stream().filter(VersionRecord::isProduction).count());
    }

    @Test
    void appendedRecordCannotClaimProductionOnItsOwn() {
        Registry registry = new Registry();
        registry.append(record("m", "1.0.0").withProduction(true));

        assertFalse(registry.require("m", "1.0.0").isProduction());
        assertTrue(registry.productionVersion("m").isEmpty());
    }

    @Test
    void removingTheProductionRecordClearsThePointer() {
        Registry registry = new Registry();
        registry.append(record("m", "1.0.0"));
        registry.pointProductionAt("m", "1.0.0");

        assertTrue(registry.remove("m", "1.0.0"));
        assertTrue(registry.productionVersion("m").isEmpty());
        assertTrue(registry.line("m").isEmpty());
    }

    @Test
    void lookupsFailWithTypedErrors() {
        Registry registry = new Registry();
        registry.append(record("m", "1.0.0"));

        assertThrows(ModelNotFoundException.class, () -> registry.line("other"));
        assertThrows(VersionNotFoundException.class, () -> registry.require("m", "9.9.9"));
        assertThrows(VersionNotFoundException.class, () -> registry.pointProductionAt("m", "9.9.9"));
    }

    @Test
    void lineIsReadOnly() {
        Registry registry = new Registry();
        registry.append(record("m", "1.0.0"));
        assertThrows(UnsupportedOperationException.class, () -> registry.line("m").clear());
    }

    @Test
    void statusTransitionsOnlyMoveForward() {
        assertTrue(VersionStatus.ACTIVE.canMoveTo(VersionStatus.DEPRECATED));
        assertTrue(VersionStatus.ACTIVE.canMoveTo(VersionStatus.ARCHIVED));
        assertTrue(VersionStatus.DEPRECATED.canMoveTo(VersionStatus.ARCHIVED));
        assertFalse(VersionStatus.ARCHIVED.canMoveTo(VersionStatus.DEPRECATED));
        assertFalse(VersionStatus.DEPRECATED.canMoveTo(VersionStatus.ACTIVE));
        assertEquals(VersionStatus.DEPRECATED, VersionStatus.from("Deprecated"));
    }
}
