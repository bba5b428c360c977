package com.mesh.registry.exception;

public class ArtifactWriteFailedException extends RegistryException {

    public ArtifactWriteFailedException(String message) {
        super("ARTIFACT_WRITE_FAILED", message);
    }

    public ArtifactWriteFailedException(String message, Throwable cause) {
        super("ARTIFACT_WRITE_FAILED", message, cause);
    }
}
