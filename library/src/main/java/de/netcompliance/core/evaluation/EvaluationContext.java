package de.netcompliance.core.evaluation;

import de.netcompliance.core.model.Device;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;

@Value
@Builder
public class EvaluationContext {
    String runId;
    Device device;
    @Builder.Default
    Clock clock = Clock.systemUTC();
}
