package com.mesh.registry.exception;

/**
 * Base type of every failure the registry reports to its callers.
 * Each subclass carries a stable error code used in API responses.
 */
public abstract class RegistryException extends RuntimeException {

    private final String errorCode;

    protected RegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RegistryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
