package com.mesh.registry.exception;

public class VersionNotFoundException extends RegistryException {

    public VersionNotFoundException(String modelName, String version) {
        super("VERSION_NOT_FOUND", "Version " + version + " not found for model " + modelName);
    }
}
