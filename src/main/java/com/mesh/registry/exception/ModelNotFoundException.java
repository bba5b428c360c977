package com.mesh.registry.exception;

public class ModelNotFoundException extends RegistryException {

    public ModelNotFoundException(String modelName) {
        super("MODEL_NOT_FOUND", "Model " + modelName + " not found in registry");
    }
}
