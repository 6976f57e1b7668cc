package de.netcompliance.core.connector;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PushResult {
    boolean committed;
    String message;
    @Builder.Default
    Map<String, Object> details = Map.of();
}
