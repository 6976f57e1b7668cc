package de.netcompliance.core.exception;

public class TransientConnectorException extends ConnectorException {

    public TransientConnectorException(final String message) {
        super(message);
    }

    public TransientConnectorException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
