package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ExecutionMode {
    SEQUENTIAL("sequential"),
    DAG("dag"),
    HYBRID("hybrid");

    @JsonValue
    private final String value;

    @JsonCreator
    public static ExecutionMode of(final String value) {
        for (ExecutionMode candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown execution mode '%s'".formatted(value));
    }
}
