package com.mesh.registry.exception;

public class NoProductionModelException extends RegistryException {

    public NoProductionModelException(String modelName) {
        super("NO_PRODUCTION_MODEL", "Model " + modelName + " has no production version");
    }
}
