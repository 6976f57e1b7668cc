package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum StepStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped"),
    SKIPPED_DEPENDENCY_FAILED("skipped_dependency_failed"),
    CANCELLED("cancelled");

    @JsonValue
    private final String value;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /**
     * Whether a dependent may run after a dependency ended in this status.
     */
    public boolean satisfiesDependents() {
        return this == COMPLETED || this == SKIPPED;
    }
}
