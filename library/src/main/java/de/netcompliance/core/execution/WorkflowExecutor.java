package de.netcompliance.core.execution;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.netcompliance.core.connector.SessionRegistry;
import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.core.exception.ComplianceIllegalStateException;
import de.netcompliance.core.exception.ExpressionException;
import de.netcompliance.core.execution.handler.DeviceContext;
import de.netcompliance.core.execution.handler.StepHandlerRegistry;
import de.netcompliance.core.execution.handler.StepOutcome;
import de.netcompliance.core.execution.handler.VariableScope;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.ExecutionMode;
import de.netcompliance.core.model.ExecutionState;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepLog;
import de.netcompliance.core.model.StepStatus;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.core.model.WorkflowExecution;
import de.netcompliance.core.repository.ResultStore;
import de.netcompliance.infrastructure.resolving.ExpressionParser;
import de.netcompliance.infrastructure.utils.SerializedLogSink;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Executes workflows against one target device.
 * <p>
 * In {@code sequential} mode steps run in declaration order and a failing step that is not
 * skippable stops the run. In {@code dag} and {@code hybrid} mode a step becomes eligible once all
 * of its dependencies are {@code completed} or {@code skipped}; eligible steps run concurrently
 * on a pool bounded by {@code max_parallel}. A step only sees the outputs of the steps it depends
 * on, directly or indirectly.
 */
@Slf4j
public class WorkflowExecutor implements AutoCloseable {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final SessionRegistry sessionRegistry;
    private final ResultStore resultStore;
    private final ValidatorRegistry validatorRegistry;
    private final ExecutionOptions options;
    private final Clock clock;
    private final StepRunner stepRunner;

    private final ExecutorService coordinators;
    private final Map<String, ExecutionHandle> executions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> finishedExecutions = new ConcurrentLinkedDeque<>();

    public WorkflowExecutor(final SessionRegistry sessionRegistry,
                            final StepHandlerRegistry handlers,
                            final ResultStore resultStore,
                            final ExecutionOptions options) {
        this(sessionRegistry, handlers, resultStore, new ValidatorRegistry(), options, Clock.systemUTC());
    }

    public WorkflowExecutor(final SessionRegistry sessionRegistry,
                            final StepHandlerRegistry handlers,
                            final ResultStore resultStore,
                            final ValidatorRegistry validatorRegistry,
                            final ExecutionOptions options,
                            final Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.resultStore = resultStore;
        this.validatorRegistry = validatorRegistry;
        this.options = options;
        this.clock = clock;
        this.stepRunner = new StepRunner(handlers);
        this.coordinators = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("workflow-coordinator-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Runs a workflow and waits for it to finish.
     *
     * @param target device the steps operate on; may be {@code null} for workflows without device steps
     * @throws ComplianceDefinitionException when the workflow is invalid; no step is executed
     */
    public WorkflowExecution execute(final Workflow workflow, final Device target, final ExecutionRequest request) {
        var handle = start(workflow, target, request);
        try {
            handle.done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComplianceIllegalStateException("Interrupted while waiting for execution " + handle.execution.getId(), e);
        }
        return handle.execution;
    }

    /**
     * Starts a workflow and returns the pending execution at once.
     *
     * @throws ComplianceDefinitionException when the workflow is invalid; no step is executed
     */
    public WorkflowExecution submit(final Workflow workflow, final Device target, final ExecutionRequest request) {
        return start(workflow, target, request).execution;
    }

    public Optional<WorkflowExecution> findExecution(final String executionId) {
        return Optional.ofNullable(executions.get(executionId)).map(handle -> handle.execution);
    }

    /**
     * Stops scheduling. Steps not started yet end {@code cancelled}; running steps finish.
     *
     * @return {@code false} if the execution is unknown or already finished
     */
    public boolean cancel(final String executionId) {
        var handle = executions.get(executionId);
        if (Objects.isNull(handle) || handle.done.getCount() == 0) return false;
        handle.cancelled = true;
        log.info("Cancelling execution {}", executionId);
        return true;
    }

    @Override
    public void close() {
        coordinators.shutdownNow();
        stepRunner.close();
    }

    private ExecutionHandle start(final Workflow workflow, final Device target, final ExecutionRequest request) {
        if (Objects.isNull(workflow)) {
            throw new ComplianceDefinitionException("No workflow given");
        }
        var validation = validatorRegistry.validate(workflow, ValidationOptions.ofDefault());
        if (validation.isInvalid()) {
            throw new ComplianceDefinitionException(validation.getMessages());
        }
        validation.getWarnings().forEach(warning -> log.warn("Workflow '{}': {}", workflow.getName(), warning));

        var effectiveRequest = Objects.isNull(request) ? ExecutionRequest.ofDefault() : request;
        var execution = WorkflowExecution.builder()
                .id(UUID.randomUUID().toString())
                .workflowName(workflow.getName())
                .deviceId(Objects.nonNull(target) ? target.getId() : null)
                .trigger(effectiveRequest.getTrigger())
                .startedBy(effectiveRequest.getStartedBy())
                .createdAt(clock.instant())
                .build();
        var handle = new ExecutionHandle(workflow, target, execution, new SerializedLogSink("execution-" + execution.getId()));
        executions.put(execution.getId(), handle);
        handle.sink.append(() -> resultStore.createExecution(execution));

        try {
            coordinators.execute(() -> run(handle, effectiveRequest));
        } catch (RejectedExecutionException e) {
            log.error("Execution {} could not be scheduled", execution.getId(), e);
            handle.failure = "Execution could not be scheduled: " + e.getMessage();
            finish(handle);
        }
        return handle;
    }

    private void run(final ExecutionHandle handle, final ExecutionRequest request) {
        var execution = handle.execution;
        var workflow = handle.workflow;
        execution.setStartedAt(clock.instant());
        execution.setState(ExecutionState.RUNNING);
        log.info("Execution {} of workflow '{}' started ({} mode, {} step(s))", execution.getId(),
                workflow.getName(), workflow.getExecutionMode().getValue(), workflow.getSteps().size());

        var session = Objects.nonNull(handle.target) ? new ExecutionSession(sessionRegistry, handle.target) : null;
        var device = new DeviceContext(execution.getId(), workflow.getName(), handle.target,
                () -> Objects.requireNonNull(session).connector());
        try {
            var base = baseScope(handle, request);
            if (workflow.getExecutionMode() == ExecutionMode.SEQUENTIAL) {
                runSequential(handle, base, device);
            } else {
                runGraph(handle, base, device);
            }
        } catch (RuntimeException e) {
            log.error("Execution {} failed unexpectedly", execution.getId(), e);
            handle.failure = "Execution failed: " + e.getMessage();
        } finally {
            if (Objects.nonNull(session)) session.close();
            finish(handle);
        }
    }

    private VariableScope baseScope(final ExecutionHandle handle, final ExecutionRequest request) {
        var variables = new LinkedHashMap<String, Object>();
        if (Objects.nonNull(handle.workflow.getVariables())) variables.putAll(handle.workflow.getVariables());
        if (Objects.nonNull(request.getVariables())) variables.putAll(request.getVariables());
        handle.execution.putVariables(variables);

        if (Objects.nonNull(handle.target)) variables.put("device", handle.target.toContext());
        var workflowContext = new LinkedHashMap<String, Object>();
        workflowContext.put("name", handle.workflow.getName());
        workflowContext.put("execution_id", handle.execution.getId());
        variables.put("workflow", workflowContext);
        return VariableScope.of(variables);
    }

    private void runSequential(final ExecutionHandle handle, final VariableScope base, final DeviceContext device) {
        var outputs = new LinkedHashMap<String, Object>();
        String failedStep = null;
        for (Step step : handle.workflow.getSteps()) {
            if (handle.cancelled) {
                record(handle, step, StepStatus.CANCELLED, null, 0, null, "Execution cancelled");
                continue;
            }
            if (Objects.nonNull(failedStep)) {
                record(handle, step, StepStatus.SKIPPED_DEPENDENCY_FAILED, null, 0, null,
                        "Skipped after step '%s' failed".formatted(failedStep));
                continue;
            }
            var scope = base.with(outputs);
            if (!shouldRun(handle, step, scope)) {
                if (handle.statuses.get(step.getName()) == StepStatus.FAILED && !step.isSkippable()) {
                    failedStep = step.getName();
                }
                continue;
            }
            var outcome = executeStep(handle, step, scope, device);
            if (outcome.isCompleted()) {
                outputs.put(step.effectiveOutputVar(), outcome.getOutput());
            } else if (!step.isSkippable()) {
                failedStep = step.getName();
            }
        }
    }

    private void runGraph(final ExecutionHandle handle, final VariableScope base, final DeviceContext device) {
        var workflow = handle.workflow;
        var graph = DependencyGraph.of(workflow.getSteps());
        var parallelism = Objects.nonNull(workflow.getSettings()) && Objects.nonNull(workflow.getSettings().getMaxParallel())
                ? workflow.getSettings().getMaxParallel()
                : options.getParallelism();
        var pool = Executors.newFixedThreadPool(Math.max(1, parallelism), new ThreadFactoryBuilder()
                .setNameFormat("execution-" + handle.execution.getId().substring(0, 8) + "-step-%d")
                .setDaemon(true)
                .build());
        CompletionService<String> completion = new ExecutorCompletionService<>(pool);
        Set<String> started = new HashSet<>();
        int running = 0;
        try {
            while (true) {
                running += schedule(handle, graph, base, device, started, completion);
                if (running == 0) break;
                var finished = completion.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                if (Objects.isNull(finished)) continue;
                running--;
                log.debug("Step '{}' of execution {} finished", finished.get(), handle.execution.getId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComplianceIllegalStateException("Interrupted while coordinating execution " + handle.execution.getId(), e);
        } catch (ExecutionException e) {
            throw new ComplianceIllegalStateException("Step of execution %s failed outside its handler"
                    .formatted(handle.execution.getId()), e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Settles every step whose fate is decided by its dependencies and starts the eligible ones.
     *
     * @return number of steps started
     */
    private int schedule(final ExecutionHandle handle,
                         final DependencyGraph graph,
                         final VariableScope base,
                         final DeviceContext device,
                         final Set<String> started,
                         final CompletionService<String> completion) {
        int submitted = 0;
        boolean progress = true;
        while (progress) {
            progress = false;
            for (String name : graph.stepNames()) {
                if (started.contains(name)) continue;
                var step = handle.workflow.findStep(name)
                        .orElseThrow(() -> new ComplianceIllegalStateException("Unknown step " + name));
                if (handle.cancelled) {
                    started.add(name);
                    record(handle, step, StepStatus.CANCELLED, null, 0, null, "Execution cancelled");
                    continue;
                }
                var dependencies = graph.dependenciesOf(name);
                var failedDependency = dependencies.stream()
                        .filter(dependency -> isFailure(handle.statuses.get(dependency)))
                        .findFirst();
                if (failedDependency.isPresent()) {
                    started.add(name);
                    record(handle, step, StepStatus.SKIPPED_DEPENDENCY_FAILED, null, 0, null,
                            "Dependency '%s' did not complete".formatted(failedDependency.get()));
                    progress = true;
                    continue;
                }
                var cancelledDependency = dependencies.stream()
                        .filter(dependency -> handle.statuses.get(dependency) == StepStatus.CANCELLED)
                        .findFirst();
                if (cancelledDependency.isPresent()) {
                    started.add(name);
                    record(handle, step, StepStatus.CANCELLED, null, 0, null,
                            "Dependency '%s' was cancelled".formatted(cancelledDependency.get()));
                    progress = true;
                    continue;
                }
                var satisfied = dependencies.stream()
                        .map(handle.statuses::get)
                        .allMatch(status -> Objects.nonNull(status) && status.satisfiesDependents());
                if (!satisfied) continue;

                started.add(name);
                var scope = scopeFor(handle, graph, name, base);
                if (!shouldRun(handle, step, scope)) {
                    progress = true;
                    continue;
                }
                handle.statuses.put(name, StepStatus.RUNNING);
                completion.submit(() -> {
                    executeStep(handle, step, scope, device);
                    return name;
                });
                submitted++;
            }
        }
        return submitted;
    }

    private static boolean isFailure(final StepStatus status) {
        return status == StepStatus.FAILED || status == StepStatus.SKIPPED_DEPENDENCY_FAILED;
    }

    private VariableScope scopeFor(final ExecutionHandle handle,
                                   final DependencyGraph graph,
                                   final String stepName,
                                   final VariableScope base) {
        var outputs = new LinkedHashMap<String, Object>();
        graph.transitiveDependencies(stepName).forEach(dependency -> {
            if (handle.statuses.get(dependency) != StepStatus.COMPLETED) return;
            handle.workflow.findStep(dependency).ifPresent(step ->
                    outputs.put(step.effectiveOutputVar(), handle.outputs.get(dependency)));
        });
        return base.with(outputs);
    }

    // records SKIPPED or FAILED when the step must not run
    private boolean shouldRun(final ExecutionHandle handle, final Step step, final VariableScope scope) {
        if (Strings.isNullOrEmpty(step.getCondition())) return true;
        try {
            if (ExpressionParser.parse(step.getCondition()).test(scope.asMap())) return true;
            record(handle, step, StepStatus.SKIPPED, null, 0, null,
                    "Condition '%s' evaluated to false".formatted(step.getCondition()));
        } catch (ExpressionException e) {
            log.warn("Condition of step '{}' could not be evaluated: {}", step.getName(), e.getMessage());
            record(handle, step, StepStatus.FAILED, null, 0, null, "Condition failed: " + e.getMessage());
        }
        return false;
    }

    private StepOutcome executeStep(final ExecutionHandle handle,
                                    final Step step,
                                    final VariableScope scope,
                                    final DeviceContext device) {
        var startedAt = clock.instant();
        handle.statuses.put(step.getName(), StepStatus.RUNNING);
        log.info("Step '{}' ({}) of execution {} started", step.getName(), step.getType().getValue(), handle.execution.getId());
        var outcome = stepRunner.run(step, scope, device, () -> handle.cancelled);
        if (outcome.isCompleted()) {
            handle.outputs.put(step.getName(), outcome.getOutput());
            handle.execution.putVariable(step.effectiveOutputVar(), outcome.getOutput());
        } else {
            log.warn("Step '{}' of execution {} failed after {} attempt(s): {}", step.getName(),
                    handle.execution.getId(), outcome.getAttempts(), outcome.getMessage());
        }
        record(handle, step, outcome.getStatus(), startedAt, outcome.getAttempts(), outcome.getOutput(), outcome.getMessage());
        return outcome;
    }

    private void record(final ExecutionHandle handle,
                        final Step step,
                        final StepStatus status,
                        final Instant startedAt,
                        final int attempts,
                        final Object output,
                        final String message) {
        var finishedAt = clock.instant();
        var stepLog = StepLog.builder()
                .stepName(step.getName())
                .stepType(step.getType())
                .status(status)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationMs(Objects.nonNull(startedAt) ? Duration.between(startedAt, finishedAt).toMillis() : null)
                .attempts(attempts)
                .output(output)
                .message(message)
                .build();
        handle.statuses.put(step.getName(), status);
        handle.sink.append(() -> {
            handle.execution.getStepLogs().add(stepLog);
            resultStore.appendStepLog(handle.execution.getId(), stepLog);
        });
    }

    private void finish(final ExecutionHandle handle) {
        handle.sink.append(() -> {
            var execution = handle.execution;
            execution.setFinishedAt(clock.instant());
            if (handle.cancelled) {
                execution.setState(ExecutionState.CANCELLED);
                execution.setMessage("Execution cancelled");
            } else if (Objects.nonNull(handle.failure)) {
                execution.setState(ExecutionState.FAILED);
                execution.setMessage(handle.failure);
            } else {
                var failed = handle.workflow.getSteps().stream()
                        .filter(step -> !step.isSkippable())
                        .filter(step -> handle.statuses.get(step.getName()) == StepStatus.FAILED)
                        .map(Step::getName)
                        .toList();
                execution.setState(failed.isEmpty() ? ExecutionState.COMPLETED : ExecutionState.FAILED);
                execution.setMessage(failed.isEmpty() ? null : "Failed step(s): " + String.join(", ", failed));
            }
            try {
                resultStore.completeExecution(execution);
            } finally {
                log.info("Execution {} of workflow '{}' {}", execution.getId(), execution.getWorkflowName(),
                        execution.getState().getValue());
                handle.done.countDown();
                handle.sink.shutdown();
                retain(execution.getId());
            }
        });
    }

    private void retain(final String executionId) {
        finishedExecutions.addLast(executionId);
        while (finishedExecutions.size() > options.getRetainedExecutions()) {
            var evicted = finishedExecutions.pollFirst();
            if (Objects.nonNull(evicted)) executions.remove(evicted);
        }
    }

    private static final class ExecutionHandle {
        private final Workflow workflow;
        private final Device target;
        private final WorkflowExecution execution;
        private final SerializedLogSink sink;
        private final Map<String, StepStatus> statuses = new ConcurrentHashMap<>();
        // step name to output; null outputs allowed
        private final Map<String, Object> outputs = Collections.synchronizedMap(new LinkedHashMap<>());
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile boolean cancelled;
        private volatile String failure;

        private ExecutionHandle(final Workflow workflow,
                                final Device target,
                                final WorkflowExecution execution,
                                final SerializedLogSink sink) {
            this.workflow = workflow;
            this.target = target;
            this.execution = execution;
            this.sink = sink;
        }
    }
}
