package de.netcompliance.exception;

public class ResourceConflictException extends RuntimeException {

    public ResourceConflictException(final String message) {
        super(message);
    }
}
