package de.netcompliance.core.audit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.netcompliance.core.connector.RetryingVendorConnector;
import de.netcompliance.core.connector.SessionLease;
import de.netcompliance.core.connector.SessionRegistry;
import de.netcompliance.core.evaluation.EvaluationContext;
import de.netcompliance.core.evaluation.RuleEvaluator;
import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.core.exception.ComplianceIllegalStateException;
import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.AuditRun;
import de.netcompliance.core.model.AuditRunState;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.DeviceAuditState;
import de.netcompliance.core.model.Finding;
import de.netcompliance.core.model.Rule;
import de.netcompliance.core.repository.DeviceInventory;
import de.netcompliance.core.repository.ResultStore;
import de.netcompliance.core.repository.RuleRepository;
import de.netcompliance.infrastructure.utils.SerializedLogSink;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Audits many devices against a set of rules.
 * <p>
 * Devices run on a bounded worker pool, so no more than {@link AuditOptions#getConcurrency()}
 * sessions are open at once. Each device gets one session for all of its checks and its own
 * timeout, counted from the moment the device starts. A device that times out, fails or is
 * cancelled still contributes one finding per planned check. Findings and state changes of a run
 * are written through one {@link SerializedLogSink}.
 */
@Slf4j
public class AuditOrchestrator implements AutoCloseable {

    private final DeviceInventory inventory;
    private final RuleRepository ruleRepository;
    private final ResultStore resultStore;
    private final SessionRegistry sessionRegistry;
    private final RuleEvaluator evaluator;
    private final ValidatorRegistry validatorRegistry;
    private final AuditOptions options;
    private final Clock clock;

    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> finishedRuns = new ConcurrentLinkedDeque<>();

    public AuditOrchestrator(final DeviceInventory inventory,
                             final RuleRepository ruleRepository,
                             final ResultStore resultStore,
                             final SessionRegistry sessionRegistry,
                             final AuditOptions options) {
        this(inventory, ruleRepository, resultStore, sessionRegistry, new RuleEvaluator(),
                new ValidatorRegistry(), options, Clock.systemUTC());
    }

    public AuditOrchestrator(final DeviceInventory inventory,
                             final RuleRepository ruleRepository,
                             final ResultStore resultStore,
                             final SessionRegistry sessionRegistry,
                             final RuleEvaluator evaluator,
                             final ValidatorRegistry validatorRegistry,
                             final AuditOptions options,
                             final Clock clock) {
        this.inventory = inventory;
        this.ruleRepository = ruleRepository;
        this.resultStore = resultStore;
        this.sessionRegistry = sessionRegistry;
        this.evaluator = evaluator;
        this.validatorRegistry = validatorRegistry;
        this.options = options;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(options.getConcurrency(), new ThreadFactoryBuilder()
                .setNameFormat("audit-worker-%d")
                .setDaemon(true)
                .build());
        this.timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("audit-timer-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Runs an audit and waits for it to finish.
     *
     * @throws ComplianceDefinitionException when the selection is rejected; no run is created
     */
    public AuditRun runAudit(final Collection<String> deviceIds, final Collection<String> ruleIds) {
        var handle = start(deviceIds, ruleIds);
        try {
            handle.done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComplianceIllegalStateException("Interrupted while waiting for audit run " + handle.run.getId(), e);
        }
        return handle.run;
    }

    /**
     * Starts an audit and returns its run id at once.
     *
     * @throws ComplianceDefinitionException when the selection is rejected; no run is created
     */
    public String submitAudit(final Collection<String> deviceIds, final Collection<String> ruleIds) {
        return start(deviceIds, ruleIds).run.getId();
    }

    public Optional<AuditRun> findRun(final String runId) {
        return Optional.ofNullable(runs.get(runId)).map(handle -> handle.run);
    }

    /**
     * Stops devices that have not started yet. Devices already running finish normally.
     *
     * @return {@code false} if the run is unknown or already finished
     */
    public boolean cancel(final String runId) {
        var handle = runs.get(runId);
        if (Objects.isNull(handle) || handle.done.getCount() == 0) return false;
        handle.cancelled = true;
        log.info("Cancelling audit run {}", runId);
        handle.collectors.values().forEach(collector -> {
            if (collector.sealIfNotStarted("Audit cancelled")) {
                recordDeviceState(handle, collector.getDevice(), DeviceAuditState.CANCELLED);
            }
        });
        return true;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        timer.shutdownNow();
    }

    private RunHandle start(final Collection<String> deviceIds, final Collection<String> ruleIds) {
        var plan = plan(deviceIds, ruleIds);
        var run = AuditRun.builder()
                .id(UUID.randomUUID().toString())
                .deviceIds(plan.devices().stream().map(Device::getId).toList())
                .ruleIds(plan.rules().stream().map(Rule::getId).toList())
                .startedAt(clock.instant())
                .state(AuditRunState.RUNNING)
                .build();
        var handle = new RunHandle(run, new SerializedLogSink("audit-" + run.getId()));
        plan.devices().forEach(device -> {
            run.getDeviceStates().put(device.getId(), DeviceAuditState.PENDING);
            handle.collectors.put(device.getId(), new DeviceFindingCollector(
                    run.getId(), device, plan.checksFor(device), finding -> recordFinding(handle, finding), clock));
        });
        handle.remaining = plan.devices().size();
        runs.put(run.getId(), handle);
        handle.sink.append(() -> resultStore.createAuditRun(run));
        log.info("Audit run {} started: {} device(s), {} rule(s), {} check(s)",
                run.getId(), plan.devices().size(), plan.rules().size(), plan.totalChecks());

        try {
            handle.collectors.values().forEach(collector ->
                    workers.execute(() -> auditDevice(handle, collector, plan.rules())));
        } catch (RejectedExecutionException e) {
            log.error("Audit run {} could not be scheduled", run.getId(), e);
            handle.failed = true;
            run.setMessage("Audit could not be scheduled: " + e.getMessage());
            handle.collectors.values().forEach(collector -> {
                if (collector.sealIfNotStarted("Audit could not be scheduled")) {
                    recordDeviceState(handle, collector.getDevice(), DeviceAuditState.ERROR);
                }
            });
        }
        return handle;
    }

    private Plan plan(final Collection<String> deviceIds, final Collection<String> ruleIds) {
        boolean noDevices = Objects.isNull(deviceIds) || deviceIds.isEmpty();
        boolean noRules = Objects.isNull(ruleIds) || ruleIds.isEmpty();
        if (noDevices && noRules) {
            throw new ComplianceDefinitionException("An audit needs at least one device and one rule");
        }
        var messages = new ArrayList<String>();
        if (noDevices) messages.add("No devices selected");
        if (noRules) messages.add("No rules selected");

        var devices = new ArrayList<Device>();
        if (!noDevices) {
            for (String deviceId : new LinkedHashSet<>(deviceIds)) {
                var device = inventory.findDevice(deviceId);
                if (device.isEmpty()) {
                    messages.add("Unknown device '%s'".formatted(deviceId));
                } else if (Objects.isNull(device.get().getVendor())) {
                    messages.add("Device '%s' has no vendor".formatted(deviceId));
                } else {
                    devices.add(device.get());
                }
            }
        }

        var rules = new ArrayList<Rule>();
        if (!noRules) {
            for (String ruleId : new LinkedHashSet<>(ruleIds)) {
                var rule = ruleRepository.findRule(ruleId);
                if (rule.isEmpty()) {
                    messages.add("Unknown rule '%s'".formatted(ruleId));
                    continue;
                }
                if (!rule.get().isEnabled()) {
                    log.info("Rule '{}' is disabled and not audited", ruleId);
                    continue;
                }
                var validation = validatorRegistry.validate(rule.get(), ValidationOptions.ofDefault());
                if (validation.isInvalid()) {
                    messages.addAll(validation.getMessages());
                } else {
                    rules.add(rule.get());
                }
            }
        }
        if (!messages.isEmpty()) throw new ComplianceDefinitionException(messages);
        if (rules.isEmpty()) throw new ComplianceDefinitionException("All selected rules are disabled");

        var plan = new Plan(devices, rules);
        if (plan.totalChecks() == 0) {
            throw new ComplianceDefinitionException("None of the selected rules applies to the selected devices");
        }
        return plan;
    }

    private void auditDevice(final RunHandle handle, final DeviceFindingCollector collector, final List<Rule> rules) {
        var device = collector.getDevice();
        if (!collector.start()) return;
        handle.sink.append(() -> handle.run.getDeviceStates().put(device.getId(), DeviceAuditState.RUNNING));
        ScheduledFuture<?> timeout = timer.schedule(
                () -> finishDevice(handle, collector, DeviceAuditState.TIMED_OUT,
                        "Device audit timed out after %d s".formatted(options.getDeviceTimeout().toSeconds())),
                options.getDeviceTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            if (options.isRespectBackoff() && device.isInBackoff(clock.instant())) {
                log.info("Skipping {}: in backoff until {}", device.getHostname(), device.getNextCheckDue());
                finishDevice(handle, collector, DeviceAuditState.ERROR,
                        "Device in backoff until %s".formatted(device.getNextCheckDue()));
                return;
            }
            try (var lease = leaseWithRetry(device)) {
                inventory.recordContact(device.getId(), true);
                var connector = new RetryingVendorConnector(lease.connector(), options.getMaxRetries(), options.getRetryDelay());
                var context = EvaluationContext.builder()
                        .runId(handle.run.getId())
                        .device(device)
                        .clock(clock)
                        .build();
                evaluator.evaluate(rules, connector, context, collector);
            }
            finishDevice(handle, collector, DeviceAuditState.COMPLETED, "Not evaluated");
        } catch (ConnectorException e) {
            log.warn("Audit of {} failed: {}", device.getHostname(), e.getMessage());
            inventory.recordContact(device.getId(), false);
            finishDevice(handle, collector, DeviceAuditState.ERROR, "Connection failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Audit of {} failed unexpectedly", device.getHostname(), e);
            finishDevice(handle, collector, DeviceAuditState.ERROR, "Device audit failed: " + e.getMessage());
        } finally {
            timeout.cancel(false);
        }
    }

    private SessionLease leaseWithRetry(final Device device) {
        int attempt = 0;
        while (true) {
            try {
                return sessionRegistry.lease(device);
            } catch (TransientConnectorException e) {
                if (attempt >= options.getMaxRetries()) throw e;
                attempt++;
                log.warn("Opening session to {} failed ({}), retry {}/{}",
                        device.getHostname(), e.getMessage(), attempt, options.getMaxRetries());
                try {
                    Thread.sleep(options.getRetryDelay().toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new TransientConnectorException("Interrupted while waiting to reconnect", interrupted);
                }
            }
        }
    }

    private void finishDevice(final RunHandle handle,
                              final DeviceFindingCollector collector,
                              final DeviceAuditState requested,
                              final String pendingMessage) {
        if (!collector.seal(pendingMessage)) return;
        var state = requested == DeviceAuditState.COMPLETED && collector.hasErrors() ? DeviceAuditState.ERROR : requested;
        if (state == DeviceAuditState.TIMED_OUT) {
            log.warn("Audit of {} timed out", collector.getDevice().getHostname());
        }
        recordDeviceState(handle, collector.getDevice(), state);
    }

    private void recordFinding(final RunHandle handle, final Finding finding) {
        handle.sink.append(() -> {
            handle.run.getFindings().add(finding);
            resultStore.appendFinding(handle.run.getId(), finding);
        });
    }

    private void recordDeviceState(final RunHandle handle, final Device device, final DeviceAuditState state) {
        handle.sink.append(() -> {
            handle.run.getDeviceStates().put(device.getId(), state);
            handle.remaining--;
            if (handle.remaining == 0) complete(handle);
        });
    }

    // runs on the run's sink thread
    private void complete(final RunHandle handle) {
        var run = handle.run;
        run.computeScores();
        run.setFinishedAt(clock.instant());
        if (handle.failed) {
            run.setState(AuditRunState.FAILED);
        } else if (handle.cancelled) {
            run.setState(AuditRunState.CANCELLED);
        } else {
            run.setState(AuditRunState.COMPLETED);
        }
        try {
            resultStore.completeAuditRun(run);
        } finally {
            log.info("Audit run {} {}: score {} ({} of {} checks passed)", run.getId(), run.getState().getValue(),
                    run.getComplianceScore(), run.getPassedChecks(), run.getTotalChecks());
            handle.done.countDown();
            handle.sink.shutdown();
            retain(run.getId());
        }
    }

    private void retain(final String runId) {
        finishedRuns.addLast(runId);
        while (finishedRuns.size() > options.getRetainedRuns()) {
            var evicted = finishedRuns.pollFirst();
            if (Objects.nonNull(evicted)) runs.remove(evicted);
        }
    }

    private static final class RunHandle {
        private final AuditRun run;
        private final SerializedLogSink sink;
        private final Map<String, DeviceFindingCollector> collectors = new LinkedHashMap<>();
        private final CountDownLatch done = new CountDownLatch(1);
        // only touched on the sink thread
        private int remaining;
        private volatile boolean cancelled;
        private volatile boolean failed;

        private RunHandle(final AuditRun run, final SerializedLogSink sink) {
            this.run = run;
            this.sink = sink;
        }
    }

    private record Plan(List<Device> devices, List<Rule> rules) {

        List<DeviceFindingCollector.PlannedCheck> checksFor(final Device device) {
            var planned = new ArrayList<DeviceFindingCollector.PlannedCheck>();
            rules.stream()
                    .filter(rule -> rule.appliesTo(device.getVendor()))
                    .forEach(rule -> rule.getChecks().forEach(check ->
                            planned.add(new DeviceFindingCollector.PlannedCheck(rule, check))));
            return planned;
        }

        int totalChecks() {
            return devices.stream().mapToInt(device -> checksFor(device).size()).sum();
        }
    }
}
