package com.mesh.registry.exception;

public class InvalidLifecycleTransitionException extends RegistryException {

    public InvalidLifecycleTransitionException(String message) {
        super("INVALID_LIFECYCLE_TRANSITION", message);
    }

    public InvalidLifecycleTransitionException(String message, Throwable cause) {
        super("INVALID_LIFECYCLE_TRANSITION", message, cause);
    }
}
