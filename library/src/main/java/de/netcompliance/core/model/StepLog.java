package de.netcompliance.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class StepLog {
    String stepName;
    StepType stepType;
    StepStatus status;
    Instant startedAt;
    Instant finishedAt;
    Long durationMs;
    int attempts;
    Object output;
    String message;
}
