package de.netcompliance.core.audit;

import de.netcompliance.core.connector.ConnectorFactory;
import de.netcompliance.core.connector.Credentials;
import de.netcompliance.core.connector.SessionRegistry;
import de.netcompliance.core.evaluation.RuleEvaluator;
import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.model.AuditRun;
import de.netcompliance.core.model.AuditRunState;
import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.DeviceAuditState;
import de.netcompliance.core.model.Finding;
import de.netcompliance.core.model.FindingStatus;
import de.netcompliance.core.model.Rule;
import de.netcompliance.core.model.VendorType;
import de.netcompliance.fixtures.FakeConnectorVariant;
import de.netcompliance.fixtures.InMemoryDeviceInventory;
import de.netcompliance.fixtures.InMemoryRuleRepository;
import de.netcompliance.fixtures.RecordingResultStore;
import de.netcompliance.infrastructure.validation.ValidatorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static de.netcompliance.fixtures.Fixtures.check;
import static de.netcompliance.fixtures.Fixtures.device;
import static de.netcompliance.fixtures.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class AuditOrchestratorTest {

    private final FakeConnectorVariant variant = new FakeConnectorVariant();
    private final RecordingResultStore resultStore = new RecordingResultStore();
    private final Rule sshRule = rule("ssh-v2",
            check("ssh version", "/ssh/server", ComparisonOperator.CONTAINS, "v2"),
            check("ssh timeout", "/ssh/timeout", ComparisonOperator.EXISTS, null));
    private final Rule ntpRule = rule("ntp", check("ntp configured", "/ntp/server", ComparisonOperator.EXISTS, null));
    private AuditOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (Objects.nonNull(orchestrator)) orchestrator.close();
    }

    private AuditOrchestrator orchestrator(final AuditOptions options, final Device... devices) {
        var factory = new ConnectorFactory(d -> Credentials.builder().username("admin").password("secret").build(), null);
        factory.register(variant);
        orchestrator = new AuditOrchestrator(
                new InMemoryDeviceInventory(devices),
                new InMemoryRuleRepository(sshRule, ntpRule),
                resultStore,
                new SessionRegistry(factory, Duration.ofSeconds(5)),
                new RuleEvaluator(),
                new ValidatorRegistry(),
                options,
                Clock.systemUTC());
        return orchestrator;
    }

    private static AuditOptions options() {
        return AuditOptions.builder()
                .concurrency(4)
                .deviceTimeout(Duration.ofSeconds(10))
                .maxRetries(0)
                .retryDelay(Duration.ofMillis(10))
                .retainedRuns(10)
                .build();
    }

    @Test
    void testAuditProducesOneFindingPerCheckAndScores() {
        // given
        final Device edge = device("edge-01", VendorType.CISCO_XR);
        final Device core = device("core-01", VendorType.CISCO_XE);
        final AuditOrchestrator orchestrator = orchestrator(options(), edge, core);
        variant.connectorFor(edge).withValue("/ssh/server", "ssh server v2").withValue("/ssh/timeout", "60")
                .withValue("/ntp/server", "10.0.0.1");
        variant.connectorFor(core).withValue("/ssh/server", "ssh server v1");

        // when
        final AuditRun run = orchestrator.runAudit(List.of("edge-01", "core-01"), List.of("ssh-v2", "ntp"));

        // then
        assertThat(run.getState()).isEqualTo(AuditRunState.COMPLETED);
        assertThat(run.getFindings()).hasSize(6);
        assertThat(run.getTotalChecks()).isEqualTo(6);
        assertThat(run.getPassedChecks()).isEqualTo(3);
        assertThat(run.getComplianceScore()).isEqualTo(50.0);
        assertThat(run.getDeviceScores()).containsEntry("edge-01", 100.0).containsEntry("core-01", 0.0);
        assertThat(run.getDeviceStates()).containsEntry("edge-01", DeviceAuditState.COMPLETED)
                .containsEntry("core-01", DeviceAuditState.COMPLETED);
        assertThat(run.getFinishedAt()).isNotNull();
        assertThat(resultStore.getFindings()).hasSize(6);
        assertThat(resultStore.getEvents().get(0)).startsWith("createAuditRun");
        assertThat(resultStore.getEvents()).last().isEqualTo("completeAuditRun completed");
    }

    @Test
    void testRulePassesOnlyWhenAllItsChecksPass() {
        // given
        final Device edge = device("edge-01", VendorType.CISCO_XR);
        final AuditOrchestrator orchestrator = orchestrator(options(), edge);
        variant.connectorFor(edge).withValue("/ssh/server", "ssh server v2").withValue("/ntp/server", "10.0.0.1");

        // when
        final AuditRun run = orchestrator.runAudit(List.of("edge-01"), List.of("ssh-v2", "ntp"));

        // then
        assertThat(run.getComplianceScore()).isEqualTo(66.67);
        assertThat(run.getRuleResults().get("edge-01"))
                .containsEntry("ssh-v2", false)
                .containsEntry("ntp", true);
    }

    @Test
    void testRejectedPathDoesNotAbortOtherRules() {
        // given
        final Device edge = device("edge-01", VendorType.CISCO_XR);
        final AuditOrchestrator orchestrator = orchestrator(options(), edge);
        variant.connectorFor(edge)
                .withValue("/ssh/timeout", "60")
                .withValue("/ntp/server", "10.0.0.1")
                .failingFetch("/ssh/server", new PermanentConnectorException("get on edge-01 failed: unknown-element"));

        // when
        final AuditRun run = orchestrator.runAudit(List.of("edge-01"), List.of("ssh-v2", "ntp"));

        // then
        assertThat(run.getFindings()).extracting(Finding::getCheckName, Finding::getStatus).containsExactlyInAnyOrder(
                tuple("ssh version", FindingStatus.ERROR),
                tuple("ssh timeout", FindingStatus.PASS),
                tuple("ntp configured", FindingStatus.PASS));
        assertThat(run.getRuleResults().get("edge-01"))
                .containsEntry("ssh-v2", false)
                .containsEntry("ntp", true);
    }

    @Test
    void testAllWritesOfARunComeFromOneThread() {
        // given
        final Device edge = device("edge-01", VendorType.CISCO_XR);
        final Device core = device("core-01", VendorType.CISCO_XR);
        final AuditOrchestrator orchestrator = orchestrator(options(), edge, core);

        // when
        orchestrator.runAudit(List.of("edge-01", "core-01"), List.of("ssh-v2"));

        // then
        assertThat(resultStore.getWriterThreads()).isNotEmpty().allSatisfy(thread ->
                assertThat(thread).startsWith("log-sink-audit-"));
        assertThat(resultStore.getWriterThreads().stream().distinct()).hasSize(1);
    }

    @Test
    void testConcurrencyBoundsOpenSessions() {
        // given
        final Device[] devices = new Device[6];
        for (int i = 0; i < devices.length; i++) {
            devices[i] = device("edge-0" + i, VendorType.CISCO_XR);
            variant.connectorFor(devices[i]).withFetchDelay(50);
        }
        final AuditOptions options = options();
        options.setConcurrency(2);
        final AuditOrchestrator orchestrator = orchestrator(options, devices);

        // when
        final AuditRun run = orchestrator.runAudit(
                List.of("edge-00", "edge-01", "edge-02", "edge-03", "edge-04", "edge-05"), List.of("ntp"));

        // then
        assertThat(run.getFindings()).hasSize(6);
        assertThat(variant.getOpened()).isEqualTo(6);
        assertThat(variant.getMaxOpen()).isLessThanOrEqualTo(2);
    }

    @Test
    void testTimedOutDeviceGetsErrorFindingsForPendingChecks() {
        // given
        final Device slow = device("slow-01", VendorType.CISCO_XR);
        variant.connectorFor(slow).withFetchDelay(1_000);
        final AuditOptions options = options();
        options.setDeviceTimeout(Duration.ofMillis(100));
        final AuditOrchestrator orchestrator = orchestrator(options, slow);

        // when
        final AuditRun run = orchestrator.runAudit(List.of("slow-01"), List.of("ssh-v2"));

        // then
        assertThat(run.getDeviceStates()).containsEntry("slow-01", DeviceAuditState.TIMED_OUT);
        assertThat(run.getFindings()).extracting(Finding::getCheckName, Finding::getStatus).containsExactlyInAnyOrder(
                tuple("ssh version", FindingStatus.ERROR),
                tuple("ssh timeout", FindingStatus.ERROR));
        assertThat(run.getFindings()).allSatisfy(finding -> assertThat(finding.getMessage()).contains("timed out"));
        assertThat(run.getComplianceScore()).isEqualTo(0.0);
    }

    @Test
    void testUnreachableDeviceDoesNotStopOthers() {
        // given
        final Device edge = device("edge-01", VendorType.CISCO_XR);
        final Device down = device("down-01", VendorType.CISCO_XR);
        variant.connectorFor(edge).withValue("/ntp/server", "10.0.0.1");
        variant.failingOpen("down-01", new PermanentConnectorException("authentication failed"));
        final InMemoryDeviceInventory inventory = new InMemoryDeviceInventory(edge, down);
        final var factory = new ConnectorFactory(d -> Credentials.builder().username("admin").build(), null);
        factory.register(variant);
        orchestrator = new AuditOrchestrator(inventory, new InMemoryRuleRepository(ntpRule), resultStore,
                new SessionRegistry(factory), new RuleEvaluator(), new ValidatorRegistry(), options(), Clock.systemUTC());

        // when
        final AuditRun run = orchestrator.runAudit(List.of("edge-01", "down-01"), List.of("ntp"));

        // then
        assertThat(run.getState()).isEqualTo(AuditRunState.COMPLETED);
        assertThat(run.getDeviceStates()).containsEntry("edge-01", DeviceAuditState.COMPLETED)
                .containsEntry("down-01", DeviceAuditState.ERROR);
        assertThat(run.getFindings()).filteredOn(finding -> finding.getDeviceId().equals("down-01"))
                .singleElement()
                .satisfies(finding -> {
                    assertThat(finding.getStatus()).isEqualTo(FindingStatus.ERROR);
                    assertThat(finding.getMessage()).contains("authentication failed");
                });
        assertThat(inventory.getContacts()).contains("edge-01 reachable", "down-01 unreachable");
    }

    @Test
    void testDeviceInBackoffIsSkipped() {
        // given
        final Device resting = device("resting-01", VendorType.CISCO_XR);
        resting.setNextCheckDue(Instant.now().plus(Duration.ofHours(1)));
        final AuditOptions options = options();
        options.setRespectBackoff(true);
        final AuditOrchestrator orchestrator = orchestrator(options, resting);

        // when
        final AuditRun run = orchestrator.runAudit(List.of("resting-01"), List.of("ntp"));

        // then
        assertThat(run.getDeviceStates()).containsEntry("resting-01", DeviceAuditState.ERROR);
        assertThat(run.getFindings()).singleElement()
                .satisfies(finding -> assertThat(finding.getMessage()).startsWith("Device in backoff until"));
        assertThat(variant.getOpened()).isZero();
    }

    @Test
    void testCancelStopsDevicesNotYetStarted() throws InterruptedException {
        // given
        final Device first = device("edge-01", VendorType.CISCO_XR);
        final Device second = device("edge-02", VendorType.CISCO_XR);
        final Device third = device("edge-03", VendorType.CISCO_XR);
        variant.connectorFor(first).withFetchDelay(300);
        final AuditOptions options = options();
        options.setConcurrency(1);
        final AuditOrchestrator orchestrator = orchestrator(options, first, second, third);

        // when
        final String runId = orchestrator.submitAudit(List.of("edge-01", "edge-02", "edge-03"), List.of("ntp"));
        Thread.sleep(100);
        final boolean cancelled = orchestrator.cancel(runId);
        final AuditRun run = awaitFinished(orchestrator, runId);

        // then
        assertThat(cancelled).isTrue();
        assertThat(run.getState()).isEqualTo(AuditRunState.CANCELLED);
        assertThat(run.getDeviceStates()).containsEntry("edge-01", DeviceAuditState.COMPLETED)
                .containsEntry("edge-02", DeviceAuditState.CANCELLED)
                .containsEntry("edge-03", DeviceAuditState.CANCELLED);
        assertThat(run.getFindings()).hasSize(3);
        assertThat(orchestrator.cancel(runId)).isFalse();
    }

    @Test
    void testInvalidSelectionCreatesNoRun() {
        // given
        final AuditOrchestrator orchestrator = orchestrator(options(), device("edge-01", VendorType.CISCO_XR));

        // when / then
        assertThatThrownBy(() -> orchestrator.runAudit(List.of("edge-01", "ghost-01"), List.of("ssh-v2", "nope")))
                .isInstanceOfSatisfying(ComplianceDefinitionException.class, e -> assertThat(e.getMessages())
                        .containsExactly("Unknown device 'ghost-01'", "Unknown rule 'nope'"));
        assertThatThrownBy(() -> orchestrator.runAudit(List.of(), List.of()))
                .isInstanceOf(ComplianceDefinitionException.class);
        assertThatThrownBy(() -> orchestrator.runAudit(List.of("edge-01"), List.of()))
                .isInstanceOfSatisfying(ComplianceDefinitionException.class, e -> assertThat(e.getMessages())
                        .containsExactly("No rules selected"));
        assertThat(resultStore.getEvents()).isEmpty();
    }

    @Test
    void testDisabledRulesAreNotAudited() {
        // given
        ntpRule.setEnabled(false);
        final AuditOrchestrator orchestrator = orchestrator(options(), device("edge-01", VendorType.CISCO_XR));

        // when
        final AuditRun run = orchestrator.runAudit(List.of("edge-01"), List.of("ssh-v2", "ntp"));

        // then
        assertThat(run.getRuleIds()).containsExactly("ssh-v2");
        assertThat(run.getFindings()).extracting(Finding::getRuleId).containsOnly("ssh-v2");
        assertThatThrownBy(() -> orchestrator.runAudit(List.of("edge-01"), List.of("ntp")))
                .isInstanceOf(ComplianceDefinitionException.class)
                .hasMessageContaining("disabled");
    }

    private static AuditRun awaitFinished(final AuditOrchestrator orchestrator, final String runId) throws InterruptedException {
        for (int i = 0; i < 100; i++) {
            var run = orchestrator.findRun(runId).orElseThrow();
            if (run.getState() != AuditRunState.RUNNING) return run;
            Thread.sleep(50);
        }
        throw new AssertionError("Audit run %s did not finish".formatted(runId));
    }
}
