package com.mesh.registry.exception;

public class ArtifactDeleteFailedException extends RegistryException {

    public ArtifactDeleteFailedException(String message) {
        super("ARTIFACT_DELETE_FAILED", message);
    }

    public ArtifactDeleteFailedException(String message, Throwable cause) {
        super("ARTIFACT_DELETE_FAILED", message, cause);
    }
}
