package de.netcompliance.core.execution.handler;

import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.NotificationPayload;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationStepHandlerTest {

    private final VariableResolver resolver = new VariableResolver(new TemplateRenderer());
    private final DeviceContext context = new DeviceContext("exec-7", "ssh-hardening", null, () -> null);
    private final List<NotificationRequest> dispatched = new CopyOnWriteArrayList<>();

    private static Step notification() {
        return Step.builder()
                .name("notify")
                .type(StepType.NOTIFICATION)
                .payload(NotificationPayload.builder()
                        .subject("Remediation on {{ host }}")
                        .message("{{ host }}: {{ result }}")
                        .channels(List.of("email", "slack"))
                        .build())
                .build();
    }

    @Test
    void testDispatchesRenderedMessage() {
        // given
        final NotificationStepHandler handler = new NotificationStepHandler(resolver, request -> {
            dispatched.add(request);
            return CompletableFuture.completedFuture(null);
        });

        // when
        final StepOutcome outcome = handler.execute(notification(),
                VariableScope.of(Map.of("host", "edge-01", "result", "compliant")), context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getOutput()).isEqualTo(Map.of(
                "message", "edge-01: compliant",
                "channels", List.of("email", "slack"),
                "dispatched", true));
        assertThat(dispatched).singleElement().satisfies(request -> {
            assertThat(request.getExecutionId()).isEqualTo("exec-7");
            assertThat(request.getWorkflowName()).isEqualTo("ssh-hardening");
            assertThat(request.getStepName()).isEqualTo("notify");
            assertThat(request.getSubject()).isEqualTo("Remediation on edge-01");
        });
    }

    @Test
    void testFailedDeliveryDoesNotFailStep() {
        // given
        final NotificationStepHandler handler = new NotificationStepHandler(resolver,
                request -> CompletableFuture.failedFuture(new IllegalStateException("smtp relay down")));

        // when
        final StepOutcome outcome = handler.execute(notification(),
                VariableScope.of(Map.of("host", "edge-01", "result", "compliant")), context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
    }

    @Test
    void testDispatcherFailureIsReportedInOutput() {
        // given
        final NotificationStepHandler handler = new NotificationStepHandler(resolver, request -> {
            throw new IllegalStateException("dispatcher closed");
        });

        // when
        final StepOutcome outcome = handler.execute(notification(),
                VariableScope.of(Map.of("host", "edge-01", "result", "compliant")), context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getMessage()).isEqualTo("Notification could not be dispatched");
        assertThat(outcome.getOutput()).isInstanceOfSatisfying(Map.class, output ->
                assertThat(output).containsEntry("dispatched", false));
    }
}
