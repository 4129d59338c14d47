package com.gridfolio.engine.exception;

public class InsufficientDataException extends PortfolioEngineException {
    private final int required;
    private final int actual;

    public InsufficientDataException(String message, int required, int actual) {
        super(message + " (required " + required + ", got " + actual + ")");
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
