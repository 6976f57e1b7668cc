package de.netcompliance.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Finding {
    String runId;
    String deviceId;
    String ruleId;
    String ruleName;
    String checkName;
    Severity severity;
    FindingStatus status;
    String rawValue;
    String expected;
    String message;
    Instant timestamp;
}
