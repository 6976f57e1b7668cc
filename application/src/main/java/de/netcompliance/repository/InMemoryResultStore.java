package de.netcompliance.repository;

import de.netcompliance.core.model.AuditRun;
import de.netcompliance.core.model.Finding;
import de.netcompliance.core.model.StepLog;
import de.netcompliance.core.model.WorkflowExecution;
import de.netcompliance.core.repository.ResultStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps audit runs and workflow executions in memory for the lifetime of the application.
 */
@Slf4j
public class InMemoryResultStore implements ResultStore {

    private final Map<String, AuditRun> auditRuns = new ConcurrentHashMap<>();
    private final Map<String, List<Finding>> findings = new ConcurrentHashMap<>();
    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, List<StepLog>> stepLogs = new ConcurrentHashMap<>();

    @Override
    public void createAuditRun(final AuditRun run) {
        auditRuns.put(run.getId(), run);
        findings.put(run.getId(), new CopyOnWriteArrayList<>());
    }

    @Override
    public void appendFinding(final String runId, final Finding finding) {
        findings.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(finding);
        log.debug("Run {}: {} {} on {} is {}", runId, finding.getRuleId(), finding.getCheckName(),
                finding.getDeviceId(), finding.getStatus().getValue());
    }

    @Override
    public void completeAuditRun(final AuditRun run) {
        auditRuns.put(run.getId(), run);
    }

    @Override
    public void createExecution(final WorkflowExecution execution) {
        executions.put(execution.getId(), execution);
        stepLogs.put(execution.getId(), new CopyOnWriteArrayList<>());
    }

    @Override
    public void appendStepLog(final String executionId, final StepLog stepLog) {
        stepLogs.computeIfAbsent(executionId, id -> new CopyOnWriteArrayList<>()).add(stepLog);
        log.debug("Execution {}: step {} is {}", executionId, stepLog.getStepName(), stepLog.getStatus().getValue());
    }

    @Override
    public void completeExecution(final WorkflowExecution execution) {
        executions.put(execution.getId(), execution);
    }

    public Optional<AuditRun> findAuditRun(final String runId) {
        return Optional.ofNullable(auditRuns.get(runId));
    }

    public List<Finding> findFindings(final String runId) {
        return List.copyOf(findings.getOrDefault(runId, List.of()));
    }

    public Optional<WorkflowExecution> findExecution(final String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    public List<StepLog> findStepLogs(final String executionId) {
        return List.copyOf(stepLogs.getOrDefault(executionId, List.of()));
    }
}
