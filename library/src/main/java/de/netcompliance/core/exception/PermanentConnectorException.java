package de.netcompliance.core.exception;

public class PermanentConnectorException extends ConnectorException {

    private final boolean sessionFailure;

    public PermanentConnectorException(final String message) {
        this(message, false);
    }

    public PermanentConnectorException(final String message, final Throwable cause) {
        super(message, cause);
        this.sessionFailure = false;
    }

    private PermanentConnectorException(final String message, final boolean sessionFailure) {
        super(message);
        this.sessionFailure = sessionFailure;
    }

    /**
     * A permanent failure of the whole session, such as rejected credentials or a peer that does
     * not speak the protocol.
     */
    public static PermanentConnectorException sessionFailure(final String message) {
        return new PermanentConnectorException(message, true);
    }

    @Override
    public boolean isTransient() {
        return false;
    }

    @Override
    public boolean isSessionFailure() {
        return sessionFailure;
    }
}
