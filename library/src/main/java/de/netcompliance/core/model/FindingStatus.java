package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum FindingStatus {
    PASS("pass"),
    FAIL("fail"),
    ERROR("error");

    @JsonValue
    private final String value;

    @JsonCreator
    public static FindingStatus of(final String value) {
        for (FindingStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown finding status '%s'".formatted(value));
    }
}
