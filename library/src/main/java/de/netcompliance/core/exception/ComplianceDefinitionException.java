package de.netcompliance.core.exception;

import java.util.List;

/**
 * A rule, audit request or workflow definition that cannot be executed. Raised synchronously,
 * before any device is contacted or any step runs.
 */
public class ComplianceDefinitionException extends RuntimeException {

    private final List<String> messages;

    public ComplianceDefinitionException(final String message) {
        super(message);
        this.messages = List.of(message);
    }

    public ComplianceDefinitionException(final String message, final Throwable cause) {
        super(message, cause);
        this.messages = List.of(message);
    }

    public ComplianceDefinitionException(final List<String> messages) {
        super(String.join("; ", messages));
        this.messages = List.copyOf(messages);
    }

    public List<String> getMessages() {
        return messages;
    }
}
