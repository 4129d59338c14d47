package com.gridfolio.engine.exception;

public class InfeasibleConstraintsException extends PortfolioEngineException {
    public InfeasibleConstraintsException(String message) {
        super(message);
    }

    public InfeasibleConstraintsException(String message, Throwable cause) {
        super(message, cause);
    }
}
