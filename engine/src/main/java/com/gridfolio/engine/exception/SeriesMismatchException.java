package com.gridfolio.engine.exception;

public class SeriesMismatchException extends PortfolioEngineException {
    public SeriesMismatchException(String message) {
        super(message);
    }

    public SeriesMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
