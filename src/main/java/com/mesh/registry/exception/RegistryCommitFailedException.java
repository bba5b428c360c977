package com.mesh.registry.exception;

/** Writing the registry document failed; the previous document is still in place. */
public class RegistryCommitFailedException extends RegistryException {

    public RegistryCommitFailedException(String message) {
        super("REGISTRY_COMMIT_FAILED", message);
    }

    public RegistryCommitFailedException(String message, Throwable cause) {
        super("REGISTRY_COMMIT_FAILED", message, cause);
    }
}
