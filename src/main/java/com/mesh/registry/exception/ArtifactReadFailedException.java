package com.mesh.registry.exception;

public class ArtifactReadFailedException extends RegistryException {

    public ArtifactReadFailedException(String message) {
        super("ARTIFACT_READ_FAILED", message);
    }

    public ArtifactReadFailedException(String message, Throwable cause) {
        super("ARTIFACT_READ_FAILED", message, cause);
    }
}
