package de.netcompliance.core.exception;

public class ExpressionException extends RuntimeException {

    public ExpressionException() {
        super();
    }

    public ExpressionException(final String message) {
        super(message);
    }

    public ExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExpressionException(final Throwable cause) {
        super(cause);
    }
}
