package com.gridfolio.engine.exception;

public class InvalidConfigurationException extends PortfolioEngineException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
