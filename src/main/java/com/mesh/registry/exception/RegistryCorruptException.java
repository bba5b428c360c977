package com.mesh.registry.exception;

/** The registry document cannot be read or violates its invariants. Requires manual repair. */
public class RegistryCorruptException extends RegistryException {

    public RegistryCorruptException(String message) {
        super("REGISTRY_CORRUPT", message);
    }

    public RegistryCorruptException(String message, Throwable cause) {
        super("REGISTRY_CORRUPT", message, cause);
    }
}
