package com.forecastplatform.common.exception;

public class UnknownModelException extends ConfigurationException {
    private final String modelName;

    public UnknownModelException(String modelName) {
        super("Model " + modelName + " is not registered in the model catalog");
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
