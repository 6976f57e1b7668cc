package de.netcompliance.core.execution.handler;

import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;

/**
 * Behaviour of one step type. Implementations must not keep per-execution state; the same
 * handler runs steps of many executions concurrently.
 */
public interface StepHandler {

    StepType type();

    /**
     * Runs one attempt of a step. Failures are reported either as a failed outcome or by throwing;
     * the caller classifies exceptions into retryable and final failures.
     */
    StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device);
}
