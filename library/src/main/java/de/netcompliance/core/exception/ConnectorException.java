package de.netcompliance.core.exception;

/**
 * Raised by vendor connectors and transports for transport or authentication failures.
 * A path that does not exist on the device is not an error and never raises this.
 */
public abstract class ConnectorException extends RuntimeException {

    protected ConnectorException(final String message) {
        super(message);
    }

    protected ConnectorException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();

    /**
     * Whether the session to the device is unusable after this failure, so later requests on it
     * would fail the same way.
     */
    public boolean isSessionFailure() {
        return isTransient();
    }
}
