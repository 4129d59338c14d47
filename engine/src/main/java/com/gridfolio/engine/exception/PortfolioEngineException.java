package com.gridfolio.engine.exception;

public class PortfolioEngineException extends RuntimeException {
    public PortfolioEngineException(String message) {
        super(message);
    }

    public PortfolioEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
