package de.netcompliance.core.execution.handler;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NotificationRequest {
    String executionId;
    String workflowName;
    String stepName;
    String subject;
    String message;
    @Builder.Default
    List<String> channels = List.of();
}
