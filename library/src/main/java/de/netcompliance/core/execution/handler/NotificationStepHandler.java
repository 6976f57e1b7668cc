package de.netcompliance.core.execution.handler;

import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.NotificationPayload;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hands a rendered message to the {@link NotificationDispatcher}. Delivery problems are logged
 * and never fail the step.
 */
@Slf4j
public class NotificationStepHandler implements StepHandler {

    private final VariableResolver resolver;
    private final NotificationDispatcher dispatcher;

    public NotificationStepHandler(final VariableResolver resolver, final NotificationDispatcher dispatcher) {
        this.resolver = resolver;
        this.dispatcher = dispatcher;
    }

    @Override
    public StepType type() {
        return StepType.NOTIFICATION;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(NotificationPayload.class);
        var message = resolver.resolveText(payload.getMessage(), scope.asMap());
        var subject = resolver.resolveText(payload.getSubject(), scope.asMap());
        List<String> channels = Objects.isNull(payload.getChannels()) ? List.of() : List.copyOf(payload.getChannels());
        var request = NotificationRequest.builder()
                .executionId(device.getExecutionId())
                .workflowName(device.getWorkflowName())
                .stepName(step.getName())
                .subject(subject)
                .message(message)
                .channels(channels)
                .build();

        boolean dispatched;
        try {
            dispatcher.dispatch(request).whenComplete((ignored, failure) -> {
                if (Objects.nonNull(failure)) {
                    log.warn("Notification '{}' of execution {} was not delivered: {}",
                            step.getName(), device.getExecutionId(), failure.getMessage());
                }
            });
            dispatched = true;
        } catch (RuntimeException e) {
            log.warn("Notification '{}' of execution {} could not be dispatched: {}",
                    step.getName(), device.getExecutionId(), e.getMessage());
            dispatched = false;
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("message", message);
        output.put("channels", channels);
        output.put("dispatched", dispatched);
        return StepOutcome.completed(output, dispatched ? null : "Notification could not be dispatched");
    }
}
