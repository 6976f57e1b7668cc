package de.netcompliance.core.execution.handler;

import de.netcompliance.core.model.StepStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StepOutcome {
    StepStatus status;
    Object output;
    String message;
    boolean retryable;
    int attempts;

    public static StepOutcome completed(final Object output) {
        return completed(output, null);
    }

    public static StepOutcome completed(final Object output, final String message) {
        return StepOutcome.builder()
                .status(StepStatus.COMPLETED)
                .output(output)
                .message(message)
                .build();
    }

    public static StepOutcome failed(final String message, final boolean retryable) {
        return failed(message, retryable, null);
    }

    public static StepOutcome failed(final String message, final boolean retryable, final Object output) {
        return StepOutcome.builder()
                .status(StepStatus.FAILED)
                .output(output)
                .message(message)
                .retryable(retryable)
                .build();
    }

    public boolean isCompleted() {
        return status == StepStatus.COMPLETED;
    }
}
