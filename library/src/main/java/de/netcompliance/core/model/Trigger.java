package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum Trigger {
    MANUAL("manual"),
    SCHEDULED("scheduled"),
    EVENT("event");

    @JsonValue
    private final String value;

    @JsonCreator
    public static Trigger of(final String value) {
        for (Trigger candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown trigger '%s'".formatted(value));
    }
}
