package de.netcompliance.core.execution;

import de.netcompliance.core.connector.ConnectorFactory;
import de.netcompliance.core.connector.Credentials;
import de.netcompliance.core.connector.SessionRegistry;
import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.core.exception.StepExecutionException;
import de.netcompliance.core.execution.handler.StepHandlerRegistry;
import de.netcompliance.core.execution.handler.StepOutcome;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.ExecutionMode;
import de.netcompliance.core.model.ExecutionState;
import de.netcompliance.core.model.OnError;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepLog;
import de.netcompliance.core.model.StepStatus;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.VendorType;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.core.model.WorkflowExecution;
import de.netcompliance.core.model.WorkflowSettings;
import de.netcompliance.core.model.payload.TransformPayload;
import de.netcompliance.fixtures.FakeConnectorVariant;
import de.netcompliance.fixtures.RecordingResultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static de.netcompliance.fixtures.Fixtures.device;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class WorkflowExecutorTest {

    private final ScriptedStepHandler handler = new ScriptedStepHandler();
    private final RecordingResultStore resultStore = new RecordingResultStore();
    private final FakeConnectorVariant variant = new FakeConnectorVariant();
    private final WorkflowExecutor executor = executor();

    private WorkflowExecutor executor() {
        var factory = new ConnectorFactory(d -> Credentials.builder().username("admin").build(), null);
        factory.register(variant);
        return new WorkflowExecutor(new SessionRegistry(factory, Duration.ofSeconds(5)),
                new StepHandlerRegistry(List.of(handler)), resultStore, ExecutionOptions.ofDefault());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private static Step step(final String name, final String... dependsOn) {
        return Step.builder()
                .name(name)
                .type(StepType.TRANSFORM)
                .dependsOn(new ArrayList<>(List.of(dependsOn)))
                .payload(TransformPayload.builder().script(".").build())
                .build();
    }

    private static Workflow workflow(final ExecutionMode mode, final Step... steps) {
        return Workflow.builder()
                .name("test-workflow")
                .executionMode(mode)
                .steps(new ArrayList<>(List.of(steps)))
                .build();
    }

    private static StepStatus statusOf(final WorkflowExecution execution, final String stepName) {
        return execution.findStepLog(stepName).map(StepLog::getStatus).orElse(null);
    }

    @Test
    void testSequentialStepsRunInOrderAndSeePreviousOutputs() {
        // given
        final Step collect = step("collect");
        collect.setOutputVar("facts");
        handler.on("collect", (s, scope, device) -> StepOutcome.completed(Map.of("hostname", "edge-01")));
        final Workflow workflow = workflow(ExecutionMode.SEQUENTIAL, collect, step("report"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(handler.started()).containsExactly("collect", "report");
        assertThat(handler.scopeOf("report").lookup("facts.hostname")).isEqualTo("edge-01");
        assertThat(execution.getVariables()).containsKeys("facts", "report");
        assertThat(execution.getStepLogs()).extracting(StepLog::getStepName, StepLog::getStatus, StepLog::getAttempts)
                .containsExactly(tuple("collect", StepStatus.COMPLETED, 1), tuple("report", StepStatus.COMPLETED, 1));
        assertThat(resultStore.getEvents()).containsExactly(
                "createExecution test-workflow",
                "appendStepLog collect completed",
                "appendStepLog report completed",
                "completeExecution completed");
    }

    @Test
    void testSequentialFailureSkipsRemainingSteps() {
        // given
        handler.on("push", (s, scope, device) -> StepOutcome.failed("commit rejected", false));
        final Workflow workflow = workflow(ExecutionMode.SEQUENTIAL, step("render"), step("push"), step("verify"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.FAILED);
        assertThat(execution.getMessage()).isEqualTo("Failed step(s): push");
        assertThat(handler.started()).containsExactly("render", "push");
        assertThat(statusOf(execution, "verify")).isEqualTo(StepStatus.SKIPPED_DEPENDENCY_FAILED);
        assertThat(execution.findStepLog("verify")).get().extracting(StepLog::getMessage)
                .isEqualTo("Skipped after step 'push' failed");
    }

    @Test
    void testSkippableStepFailureDoesNotStopExecution() {
        // given
        final Step notify = step("notify");
        notify.setOnError(OnError.CONTINUE);
        handler.on("notify", (s, scope, device) -> StepOutcome.failed("mail relay down", false));
        final Workflow workflow = workflow(ExecutionMode.SEQUENTIAL, notify, step("report"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(statusOf(execution, "notify")).isEqualTo(StepStatus.FAILED);
        assertThat(statusOf(execution, "report")).isEqualTo(StepStatus.COMPLETED);
    }

    @Test
    void testDagRunsIndependentStepsConcurrentlyAndJoins() {
        // given
        final CountDownLatch bothRunning = new CountDownLatch(2);
        final ScriptedStepHandler.Behaviour rendezvous = (s, scope, device) -> {
            bothRunning.countDown();
            var met = bothRunning.await(5, TimeUnit.SECONDS);
            return StepOutcome.completed(Map.of("met", met));
        };
        handler.on("a", rendezvous).on("b", rendezvous);
        final Workflow workflow = workflow(ExecutionMode.DAG, step("a"), step("b"), step("c", "a", "b"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(handler.started()).hasSize(3).endsWith("c");
        assertThat(handler.maxRunning()).isGreaterThanOrEqualTo(2);
        assertThat(handler.scopeOf("c").lookup("a.met")).isEqualTo(true);
        assertThat(handler.scopeOf("c").lookup("b.met")).isEqualTo(true);
    }

    @Test
    void testDagStepSeesOnlyOutputsOfItsDependencies() {
        // given
        final Workflow workflow = workflow(ExecutionMode.DAG,
                step("a"), step("b"), step("c", "a"), step("d", "c"));

        // when
        executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(handler.scopeOf("c").asMap()).containsKey("a").doesNotContainKeys("b", "d");
        assertThat(handler.scopeOf("d").asMap()).containsKeys("a", "c").doesNotContainKey("b");
    }

    @Test
    void testDagFailureSkipsDependentsOnly() {
        // given
        handler.on("a", (s, scope, device) -> StepOutcome.failed("device unreachable", false));
        final Workflow workflow = workflow(ExecutionMode.DAG,
                step("a"), step("b"), step("c", "a"), step("d", "c"), step("e", "b"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.FAILED);
        assertThat(statusOf(execution, "a")).isEqualTo(StepStatus.FAILED);
        assertThat(statusOf(execution, "b")).isEqualTo(StepStatus.COMPLETED);
        assertThat(statusOf(execution, "c")).isEqualTo(StepStatus.SKIPPED_DEPENDENCY_FAILED);
        assertThat(statusOf(execution, "d")).isEqualTo(StepStatus.SKIPPED_DEPENDENCY_FAILED);
        assertThat(statusOf(execution, "e")).isEqualTo(StepStatus.COMPLETED);
        assertThat(handler.started()).containsExactlyInAnyOrder("a", "b", "e");
        assertThat(execution.findStepLog("c")).get().extracting(StepLog::getMessage)
                .isEqualTo("Dependency 'a' did not complete");
    }

    @Test
    void testHybridDiamondJoinsParallelBranches() {
        // given
        final CountDownLatch branchesRunning = new CountDownLatch(2);
        final ScriptedStepHandler.Behaviour branch = (s, scope, device) -> {
            branchesRunning.countDown();
            var met = branchesRunning.await(5, TimeUnit.SECONDS);
            return StepOutcome.completed(Map.of("met", met, "seen", scope.lookup("a.step")));
        };
        handler.on("b", branch).on("c", branch);
        final Workflow workflow = workflow(ExecutionMode.HYBRID,
                step("a"), step("b", "a"), step("c", "a"), step("d", "b", "c"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(handler.started()).hasSize(4).startsWith("a").endsWith("d");
        assertThat(handler.maxRunning()).isGreaterThanOrEqualTo(2);
        assertThat(handler.scopeOf("d").asMap()).containsKeys("a", "b", "c");
        assertThat(handler.scopeOf("d").lookup("b.met")).isEqualTo(true);
        assertThat(handler.scopeOf("d").lookup("c.seen")).isEqualTo("a");
        assertThat(execution.getStepLogs()).extracting(StepLog::getStatus).containsOnly(StepStatus.COMPLETED);
    }

    @Test
    void testHybridBranchFailureSkipsJoinButNotSiblingBranch() {
        // given
        handler.on("b", (s, scope, device) -> StepOutcome.failed("commit rejected", false));
        final Workflow workflow = workflow(ExecutionMode.HYBRID,
                step("a"), step("b", "a"), step("c", "a"), step("d", "b", "c"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.FAILED);
        assertThat(statusOf(execution, "a")).isEqualTo(StepStatus.COMPLETED);
        assertThat(statusOf(execution, "b")).isEqualTo(StepStatus.FAILED);
        assertThat(statusOf(execution, "c")).isEqualTo(StepStatus.COMPLETED);
        assertThat(statusOf(execution, "d")).isEqualTo(StepStatus.SKIPPED_DEPENDENCY_FAILED);
        assertThat(handler.started()).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void testFalseConditionSkipsStepButNotItsDependents() {
        // given
        final Step remediate = step("remediate", "audit");
        remediate.setCondition("{{ audit.passed == false }}");
        handler.on("audit", (s, scope, device) -> StepOutcome.completed(Map.of("passed", true)));
        final Workflow workflow = workflow(ExecutionMode.DAG, step("audit"), remediate, step("report", "remediate"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(statusOf(execution, "remediate")).isEqualTo(StepStatus.SKIPPED);
        assertThat(statusOf(execution, "report")).isEqualTo(StepStatus.COMPLETED);
        assertThat(handler.started()).containsExactly("audit", "report");
        assertThat(handler.scopeOf("report").asMap()).doesNotContainKey("remediate");
    }

    @Test
    void testConditionThatCannotBeEvaluatedFailsStep() {
        // given
        final Step step = step("compare");
        step.setCondition("facts.count > 'many'");
        final Workflow workflow = Workflow.builder()
                .name("test-workflow")
                .executionMode(ExecutionMode.SEQUENTIAL)
                .variables(new LinkedHashMap<>(Map.of("facts", Map.of("count", 3))))
                .steps(new ArrayList<>(List.of(step)))
                .build();

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.FAILED);
        assertThat(execution.findStepLog("compare")).get().extracting(StepLog::getMessage).asString()
                .startsWith("Condition failed");
        assertThat(handler.started()).isEmpty();
    }

    @Test
    void testCyclicWorkflowIsRejectedBeforeAnyStepRuns() {
        // given
        final Workflow workflow = workflow(ExecutionMode.DAG, step("a", "c"), step("b", "a"), step("c", "b"));

        // when / then
        assertThatThrownBy(() -> executor.execute(workflow, null, ExecutionRequest.ofDefault()))
                .isInstanceOfSatisfying(ComplianceDefinitionException.class, e -> assertThat(e.getMessages())
                        .anySatisfy(message -> assertThat(message).contains("dependency cycle")));
        assertThat(handler.started()).isEmpty();
        assertThat(resultStore.getEvents()).isEmpty();
    }

    @Test
    void testUnknownDependencyIsRejected() {
        // given
        final Workflow workflow = workflow(ExecutionMode.DAG, step("a", "ghost"));

        // when / then
        assertThatThrownBy(() -> executor.submit(workflow, null, ExecutionRequest.ofDefault()))
                .isInstanceOf(ComplianceDefinitionException.class)
                .hasMessageContaining("unknown step 'ghost'");
    }

    @Test
    void testRetryableFailuresAreRetried() {
        // given
        final AtomicInteger calls = new AtomicInteger();
        final Step flaky = step("flaky");
        flaky.setRetryCount(2);
        flaky.setRetryDelay(Duration.ofMillis(10));
        handler.on("flaky", (s, scope, device) -> {
            if (calls.incrementAndGet() < 3) throw new StepExecutionException("HTTP 503", true);
            return StepOutcome.completed("ok");
        });

        // when
        final WorkflowExecution execution = executor.execute(workflow(ExecutionMode.SEQUENTIAL, flaky), null,
                ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(execution.findStepLog("flaky")).get().extracting(StepLog::getAttempts).isEqualTo(3);
    }

    @Test
    void testNonRetryableFailureIsNotRetried() {
        // given
        final AtomicInteger calls = new AtomicInteger();
        final Step broken = step("broken");
        broken.setRetryCount(3);
        broken.setRetryDelay(Duration.ofMillis(10));
        handler.on("broken", (s, scope, device) -> {
            calls.incrementAndGet();
            throw new StepExecutionException("HTTP 404", false);
        });

        // when
        final WorkflowExecution execution = executor.execute(workflow(ExecutionMode.SEQUENTIAL, broken), null,
                ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.FAILED);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(execution.findStepLog("broken")).get().extracting(StepLog::getMessage).isEqualTo("HTTP 404");
    }

    @Test
    void testStepTimeoutFailsAttempt() {
        // given
        final Step slow = step("slow");
        slow.setTimeout(Duration.ofMillis(100));
        handler.on("slow", (s, scope, device) -> {
            Thread.sleep(1_000);
            return StepOutcome.completed("late");
        });

        // when
        final WorkflowExecution execution = executor.execute(workflow(ExecutionMode.SEQUENTIAL, slow), null,
                ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.FAILED);
        assertThat(execution.findStepLog("slow")).get().extracting(StepLog::getMessage).asString()
                .contains("timed out after 100 ms");
    }

    @Test
    void testMaxParallelLimitsConcurrentSteps() {
        // given
        final ScriptedStepHandler.Behaviour slow = (s, scope, device) -> {
            Thread.sleep(50);
            return StepOutcome.completed(s.getName());
        };
        handler.on("a", slow).on("b", slow).on("c", slow);
        final Workflow workflow = workflow(ExecutionMode.DAG, step("a"), step("b"), step("c"));
        workflow.setSettings(WorkflowSettings.builder().maxParallel(1).build());

        // when
        final WorkflowExecution execution = executor.execute(workflow, null, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(handler.maxRunning()).isEqualTo(1);
    }

    @Test
    void testCancelStopsStepsNotYetStarted() throws InterruptedException {
        // given
        final CountDownLatch firstStarted = new CountDownLatch(1);
        handler.on("first", (s, scope, device) -> {
            firstStarted.countDown();
            Thread.sleep(300);
            return StepOutcome.completed("done");
        });
        final Workflow workflow = workflow(ExecutionMode.SEQUENTIAL, step("first"), step("second"), step("third"));

        // when
        final WorkflowExecution submitted = executor.submit(workflow, null, ExecutionRequest.ofDefault());
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
        final boolean cancelled = executor.cancel(submitted.getId());
        final WorkflowExecution execution = awaitFinished(submitted.getId());

        // then
        assertThat(cancelled).isTrue();
        assertThat(execution.getState()).isEqualTo(ExecutionState.CANCELLED);
        assertThat(statusOf(execution, "first")).isEqualTo(StepStatus.COMPLETED);
        assertThat(statusOf(execution, "second")).isEqualTo(StepStatus.CANCELLED);
        assertThat(statusOf(execution, "third")).isEqualTo(StepStatus.CANCELLED);
        assertThat(executor.cancel(submitted.getId())).isFalse();
    }

    @Test
    void testRequestVariablesOverrideWorkflowVariables() {
        // given
        final Workflow workflow = workflow(ExecutionMode.SEQUENTIAL, step("show"));
        workflow.setVariables(new LinkedHashMap<>(Map.of("ntp_server", "10.0.0.1", "site", "fra")));
        final Device target = device("edge-01", VendorType.CISCO_XR);

        // when
        final WorkflowExecution execution = executor.execute(workflow, target, ExecutionRequest.builder()
                .variables(Map.of("ntp_server", "10.9.9.9"))
                .startedBy("netops")
                .build());

        // then
        assertThat(handler.scopeOf("show").get("ntp_server")).isEqualTo("10.9.9.9");
        assertThat(handler.scopeOf("show").get("site")).isEqualTo("fra");
        assertThat(handler.scopeOf("show").lookup("device.hostname")).isEqualTo("edge-01.lab");
        assertThat(handler.scopeOf("show").lookup("workflow.execution_id")).isEqualTo(execution.getId());
        assertThat(execution.getStartedBy()).isEqualTo("netops");
        assertThat(execution.getDeviceId()).isEqualTo("edge-01");
        assertThat(variant.getOpened()).isZero();
    }

    @Test
    void testStepsShareOneLazilyOpenedSession() {
        // given
        final Device target = device("edge-01", VendorType.CISCO_XR);
        variant.connectorFor(target).withValue("/ssh", "v2");
        final ScriptedStepHandler.Behaviour fetch = (s, scope, device) ->
                StepOutcome.completed(device.connector().fetch("/ssh", null).getValue().orElse(null));
        handler.on("a", fetch).on("b", fetch);
        final Workflow workflow = workflow(ExecutionMode.DAG, step("a"), step("b"));

        // when
        final WorkflowExecution execution = executor.execute(workflow, target, ExecutionRequest.ofDefault());

        // then
        assertThat(execution.getState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(execution.getVariables()).containsEntry("a", "v2").containsEntry("b", "v2");
        assertThat(variant.getOpened()).isEqualTo(1);
        assertThat(variant.connectorFor(target).isClosed()).isTrue();
    }

    @Test
    void testFinishedExecutionIsFoundById() {
        // when
        final WorkflowExecution execution = executor.execute(workflow(ExecutionMode.HYBRID, step("a")), null,
                ExecutionRequest.ofDefault());

        // then
        assertThat(executor.findExecution(execution.getId())).containsSame(execution);
        assertThat(executor.findExecution("unknown")).isEmpty();
    }

    private WorkflowExecution awaitFinished(final String executionId) throws InterruptedException {
        for (int i = 0; i < 100; i++) {
            var execution = executor.findExecution(executionId).orElseThrow();
            if (execution.getState().isTerminal() && execution.getFinishedAt() != null) return execution;
            Thread.sleep(50);
        }
        throw new AssertionError("Execution %s did not finish".formatted(executionId));
    }
}
