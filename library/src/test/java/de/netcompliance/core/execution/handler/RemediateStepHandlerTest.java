package de.netcompliance.core.execution.handler;

import de.netcompliance.core.connector.PathEdit;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.exception.StepExecutionException;
import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.VendorType;
import de.netcompliance.core.model.payload.RemediatePayload;
import de.netcompliance.fixtures.FakeVendorConnector;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static de.netcompliance.fixtures.Fixtures.device;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemediateStepHandlerTest {

    private final RemediateStepHandler handler = new RemediateStepHandler(new VariableResolver(new TemplateRenderer()));

    private final Device xmlDevice = device("edge-01", VendorType.CISCO_XR);
    private final FakeVendorConnector xmlConnector = new FakeVendorConnector(xmlDevice);

    private static Step remediate(final RemediatePayload payload) {
        return Step.builder().name("fix-ssh").type(StepType.REMEDIATE).payload(payload).build();
    }

    private static DeviceContext context(final Device device, final FakeVendorConnector connector) {
        return new DeviceContext("exec-1", "ssh-hardening", device, () -> connector);
    }

    private static VariableScope renderedScope() {
        return VariableScope.of(Map.of(
                "render", Map.of("rendered_config", "<ssh><server>v2</server></ssh>", "format", "xml"),
                "ticket", "CHG-42"));
    }

    @Test
    void testPushesRenderedConfigToXmlDevice() {
        // given
        final RemediatePayload payload = RemediatePayload.builder().configSource("{{ render }}").build();
        payload.getVendorSpecific().put("cisco_xr", RemediatePayload.VendorRemediation.builder()
                .commitComment("fix {{ ticket }}")
                .build());

        // when
        final StepOutcome outcome = handler.execute(remediate(payload), renderedScope(), context(xmlDevice, xmlConnector));

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getOutput()).isEqualTo(Map.of(
                "success", true,
                "protocol", "netconf_xml",
                "committed", true,
                "result", "Configuration committed"));
        assertThat(xmlConnector.getCalls()).containsExactly("push");
        assertThat(xmlConnector.getPushes()).singleElement().satisfies(request -> {
            assertThat(request.getConfigXml()).isEqualTo("<ssh><server>v2</server></ssh>");
            assertThat(request.getTarget()).isEqualTo("candidate");
            assertThat(request.getCommitComment()).isEqualTo("fix CHG-42");
        });
    }

    @Test
    void testFailedPushIsRolledBackBeforeStepFails() {
        // given
        xmlConnector.failingPush(new TransientConnectorException("commit timed out"));
        final RemediatePayload payload = RemediatePayload.builder()
                .configSource("{{ render }}")
                .rollbackOnError(true)
                .build();

        // when
        final StepOutcome outcome = handler.execute(remediate(payload), renderedScope(), context(xmlDevice, xmlConnector));

        // then
        assertThat(outcome.isCompleted()).isFalse();
        assertThat(outcome.isRetryable()).isTrue();
        assertThat(outcome.getMessage())
                .isEqualTo("Remediation failed: commit timed out; rollback succeeded: Pre-change configuration restored");
        assertThat(xmlConnector.getCalls()).containsExactly("snapshot", "push", "restore");
        assertThat(outcome.getOutput()).isInstanceOfSatisfying(Map.class, output ->
                assertThat(output).containsEntry("success", false).containsEntry("committed", false));
    }

    @Test
    void testFailedPushWithoutRollbackLeavesDeviceAlone() {
        // given
        xmlConnector.failingPush(new PermanentConnectorException("access denied"));
        final RemediatePayload payload = RemediatePayload.builder().configSource("{{ render }}").build();

        // when
        final StepOutcome outcome = handler.execute(remediate(payload), renderedScope(), context(xmlDevice, xmlConnector));

        // then
        assertThat(outcome.isRetryable()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("Remediation failed: access denied");
        assertThat(xmlConnector.getCalls()).containsExactly("push");
    }

    @Test
    void testModelPathDeviceGetsResolvedEdits() {
        // given
        final Device device = device("pe-01", VendorType.NOKIA_SROS);
        final FakeVendorConnector connector = new FakeVendorConnector(device);
        final RemediatePayload payload = RemediatePayload.builder().build();
        payload.getVendorSpecific().put("nokia_sros", RemediatePayload.VendorRemediation.builder()
                .operations(List.of(
                        RemediatePayload.PathOperation.builder()
                                .path("/configure/system/security/ssh/version")
                                .value("{{ ssh_version }}")
                                .build(),
                        RemediatePayload.PathOperation.builder()
                                .path("/configure/system/security/telnet")
                                .action("delete")
                                .build()))
                .build());

        // when
        final StepOutcome outcome = handler.execute(remediate(payload),
                VariableScope.of(Map.of("ssh_version", 2)), context(device, connector));

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(connector.getPushes()).singleElement().extracting("edits").isEqualTo(List.of(
                PathEdit.update("/configure/system/security/ssh/version", 2),
                new PathEdit("/configure/system/security/telnet", PathEdit.Action.DELETE, null)));
    }

    @Test
    void testModelPathDeviceNeedsOperationsOrPath() {
        // given
        final Device device = device("pe-01", VendorType.NOKIA_SROS);
        final RemediatePayload payload = RemediatePayload.builder().configSource("<xml/>").build();

        // when / then
        assertThatThrownBy(() -> handler.execute(remediate(payload), VariableScope.empty(),
                context(device, new FakeVendorConnector(device))))
                .isInstanceOfSatisfying(StepExecutionException.class, e -> assertThat(e.isRetryable()).isFalse())
                .hasMessageContaining("nokia_sros");
    }
}
