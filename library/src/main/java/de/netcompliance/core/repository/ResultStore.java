package de.netcompliance.core.repository;

import de.netcompliance.core.model.AuditRun;
import de.netcompliance.core.model.Finding;
import de.netcompliance.core.model.StepLog;
import de.netcompliance.core.model.WorkflowExecution;

/**
 * Where audit runs and workflow executions are persisted. Calls for one run or execution
 * arrive from a single writer thread, in order.
 */
public interface ResultStore {

    void createAuditRun(final AuditRun run);

    void appendFinding(final String runId, final Finding finding);

    void completeAuditRun(final AuditRun run);

    void createExecution(final WorkflowExecution execution);

    void appendStepLog(final String executionId, final StepLog stepLog);

    void completeExecution(final WorkflowExecution execution);
}
