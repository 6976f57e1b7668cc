package de.netcompliance.core.connector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

public record PathEdit(String path, Action action, Object value) {

    public static PathEdit update(final String path, final Object value) {
        return new PathEdit(path, Action.UPDATE, value);
    }

    public static PathEdit replace(final String path, final Object value) {
        return new PathEdit(path, Action.REPLACE, value);
    }

    public static PathEdit delete(final String path) {
        return new PathEdit(path, Action.DELETE, null);
    }

    @Getter
    @AllArgsConstructor
    public enum Action {
        UPDATE("update"),
        REPLACE("replace"),
        DELETE("delete");

        @JsonValue
        private final String value;

        @JsonCreator
        public static Action of(final String value) {
            for (Action candidate : values()) {
                if (candidate.value.equalsIgnoreCase(value)) return candidate;
            }
            // "merge" is the NETCONF spelling of an update
            if ("merge".equalsIgnoreCase(value)) return UPDATE;
            throw new IllegalArgumentException("Unknown edit action '%s'".formatted(value));
        }
    }
}
