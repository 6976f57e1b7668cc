package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What a step failure means for the whole execution. {@code CONTINUE} marks the step as skippable.
 */
@Getter
@AllArgsConstructor
public enum OnError {
    FAIL("fail"),
    CONTINUE("continue");

    @JsonValue
    private final String value;

    @JsonCreator
    public static OnError of(final String value) {
        for (OnError candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown on_error value '%s'".formatted(value));
    }
}
