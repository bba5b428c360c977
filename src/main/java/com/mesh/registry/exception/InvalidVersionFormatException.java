package com.mesh.registry.exception;

/** A version string is not three non-negative integers separated by dots. */
public class InvalidVersionFormatException extends RegistryException {

    public InvalidVersionFormatException(String message) {
        super("INVALID_VERSION_FORMAT", message);
    }

    public InvalidVersionFormatException(String message, Throwable cause) {
        super("INVALID_VERSION_FORMAT", message, cause);
    }
}
