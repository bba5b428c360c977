package com.mesh.registry.exception;

/** The registry lock could not be acquired in time. Safe to retry. */
public class RegistryBusyException extends RegistryException {

    public RegistryBusyException(String message) {
        super("REGISTRY_BUSY", message);
    }

    public RegistryBusyException(String message, Throwable cause) {
        super("REGISTRY_BUSY", message, cause);
    }
}
