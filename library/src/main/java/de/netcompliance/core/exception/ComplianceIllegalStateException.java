package de.netcompliance.core.exception;

public class ComplianceIllegalStateException extends RuntimeException {

    public ComplianceIllegalStateException() {
        super();
    }

    public ComplianceIllegalStateException(final String message) {
        super(message);
    }

    public ComplianceIllegalStateException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ComplianceIllegalStateException(final Throwable cause) {
        super(cause);
    }
}
