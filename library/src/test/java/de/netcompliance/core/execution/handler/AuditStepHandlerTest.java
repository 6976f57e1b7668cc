package de.netcompliance.core.execution.handler;

import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.AuditPayload;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditStepHandlerTest {

    private final AuditStepHandler handler = new AuditStepHandler(new VariableResolver(new TemplateRenderer()));
    private final DeviceContext context = new DeviceContext("exec-1", "ssh-hardening", null, () -> null);

    private final VariableScope scope = VariableScope.of(Map.of(
            "running", Map.of("ssh", Map.of("version", "2", "timeout", "60"), "ntp", Map.of("server", "10.0.0.9")),
            "golden", Map.of("ssh", Map.of("version", "2", "timeout", "60"), "ntp", Map.of("server", "10.0.0.1"))));

    private static Step audit(final AuditPayload payload) {
        return Step.builder().name("compare").type(StepType.AUDIT).payload(payload).build();
    }

    @Test
    void testSingleValueComparison() {
        // given
        final AuditPayload payload = AuditPayload.builder()
                .compare(AuditPayload.Compare.builder().actual("{{ running.ssh.version }}").expected("2").build())
                .build();

        // when
        final StepOutcome outcome = handler.execute(audit(payload), scope, context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getMessage()).isEqualTo("1 of 1 compared values match (100.00%)");
        assertThat(outcome.getOutput()).isInstanceOfSatisfying(Map.class, output ->
                assertThat(output).containsEntry("passed", true).containsEntry("compliance", 100.0));
    }

    @Test
    void testFieldComparisonReportsComplianceShare() {
        // given
        final AuditPayload payload = AuditPayload.builder()
                .compare(AuditPayload.Compare.builder().actual("{{ running }}").expected("{{ golden }}").build())
                .fields(List.of("ssh.version", "$.ssh.timeout", "$.ntp.server", "$.missing"))
                .passThreshold(50)
                .build();

        // when
        final StepOutcome outcome = handler.execute(audit(payload), scope, context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getOutput()).isInstanceOfSatisfying(Map.class, output -> assertThat(output)
                .containsEntry("passed", true)
                .containsEntry("compliance", 50.0)
                .containsEntry("matched", 2)
                .containsEntry("total", 4)
                .containsEntry("mismatched_fields", List.of("$.ntp.server", "$.missing")));
    }

    @Test
    void testMismatchFailsStepWhenRequested() {
        // given
        final AuditPayload payload = AuditPayload.builder()
                .compare(AuditPayload.Compare.builder().actual("{{ running }}").expected("{{ golden }}").build())
                .fields(List.of("ntp.server"))
                .failOnMismatch(true)
                .build();

        // when
        final StepOutcome outcome = handler.execute(audit(payload), scope, context);

        // then
        assertThat(outcome.isCompleted()).isFalse();
        assertThat(outcome.isRetryable()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("Audit failed: 0 of 1 compared values match (0.00%)");
    }

    @Test
    void testContainsOperatorOnRenderedText() {
        // given
        final AuditPayload payload = AuditPayload.builder()
                .compare(AuditPayload.Compare.builder()
                        .actual("ip ssh version 2\nip ssh time-out 60")
                        .expected("ssh version 2")
                        .build())
                .operator(ComparisonOperator.CONTAINS)
                .build();

        // when
        final StepOutcome outcome = handler.execute(audit(payload), scope, context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getOutput()).isInstanceOfSatisfying(Map.class, output ->
                assertThat(output).containsEntry("passed", true));
    }
}
