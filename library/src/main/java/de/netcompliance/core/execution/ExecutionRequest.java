package de.netcompliance.core.execution;

import de.netcompliance.core.model.Trigger;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Caller side of an execution: variable overrides and who started it.
 */
@Value
@Builder
public class ExecutionRequest {
    @Builder.Default
    Map<String, Object> variables = Map.of();
    @Builder.Default
    Trigger trigger = Trigger.MANUAL;
    String startedBy;

    public static ExecutionRequest ofDefault() {
        return ExecutionRequest.builder().build();
    }
}
