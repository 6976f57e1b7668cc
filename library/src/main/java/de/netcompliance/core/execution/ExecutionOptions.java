package de.netcompliance.core.execution;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExecutionOptions {

    public static final int DEFAULT_PARALLELISM = 4;

    // concurrent steps of one dag execution, unless the workflow sets max_parallel
    @Builder.Default
    private int parallelism = DEFAULT_PARALLELISM;
    // finished executions kept for lookup
    @Builder.Default
    private int retainedExecutions = 100;

    public static ExecutionOptions ofDefault() {
        return ExecutionOptions.builder().build();
    }
}
