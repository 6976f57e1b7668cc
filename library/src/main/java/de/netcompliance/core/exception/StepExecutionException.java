package de.netcompliance.core.exception;

public class StepExecutionException extends RuntimeException {

    private final boolean retryable;

    public StepExecutionException(final String message, final boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StepExecutionException(final String message, final Throwable cause, final boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
