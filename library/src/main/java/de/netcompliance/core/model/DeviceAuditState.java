package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum DeviceAuditState {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    TIMED_OUT("timed_out"),
    ERROR("error"),
    CANCELLED("cancelled");

    @JsonValue
    private final String value;

    @JsonCreator
    public static DeviceAuditState of(final String value) {
        for (DeviceAuditState candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown device audit state '%s'".formatted(value));
    }
}
