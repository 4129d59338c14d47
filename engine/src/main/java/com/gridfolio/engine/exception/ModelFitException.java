package com.gridfolio.engine.exception;

public class ModelFitException extends PortfolioEngineException {
    public ModelFitException(String message) {
        super(message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
