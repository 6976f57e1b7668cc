package de.netcompliance.service;

import de.netcompliance.core.audit.AuditOrchestrator;
import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.core.execution.ExecutionRequest;
import de.netcompliance.core.execution.WorkflowExecutor;
import de.netcompliance.core.model.AuditRun;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.Trigger;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.core.model.WorkflowExecution;
import de.netcompliance.core.repository.DeviceInventory;
import de.netcompliance.exception.ResourceConflictException;
import de.netcompliance.exception.ResourceNotFoundException;
import de.netcompliance.model.AuditRequestDto;
import de.netcompliance.model.ExecutionRequestDto;
import de.netcompliance.model.WorkflowSummaryDto;
import de.netcompliance.repository.WorkflowCatalog;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
public class ComplianceService {

    private final AuditOrchestrator auditOrchestrator;
    private final WorkflowExecutor workflowExecutor;
    private final WorkflowCatalog workflowCatalog;
    private final DeviceInventory deviceInventory;

    public ComplianceService(final AuditOrchestrator auditOrchestrator,
                             final WorkflowExecutor workflowExecutor,
                             final WorkflowCatalog workflowCatalog,
                             final DeviceInventory deviceInventory) {
        this.auditOrchestrator = auditOrchestrator;
        this.workflowExecutor = workflowExecutor;
        this.workflowCatalog = workflowCatalog;
        this.deviceInventory = deviceInventory;
    }

    public String submitAudit(final AuditRequestDto request) {
        var runId = auditOrchestrator.submitAudit(request.getDeviceIds(), request.getRuleIds());
        log.info("Accepted audit run {}", runId);
        return runId;
    }

    public AuditRun findAuditRun(final String runId) {
        return auditOrchestrator.findRun(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Unknown audit run '%s'".formatted(runId)));
    }

    public void cancelAuditRun(final String runId) {
        findAuditRun(runId);
        if (!auditOrchestrator.cancel(runId)) {
            throw new ResourceConflictException("Audit run '%s' has already finished".formatted(runId));
        }
    }

    public List<WorkflowSummaryDto> findWorkflows() {
        return workflowCatalog.findAll().stream()
                .sorted(Comparator.comparing(Workflow::getName))
                .map(workflow -> WorkflowSummaryDto.builder()
                        .name(workflow.getName())
                        .description(workflow.getDescription())
                        .executionMode(workflow.getExecutionMode().getValue())
                        .steps(workflow.getSteps().stream().map(Step::getName).toList())
                        .build())
                .toList();
    }

    public WorkflowExecution startExecution(final String workflowName, final ExecutionRequestDto request) {
        var workflow = workflowCatalog.findWorkflow(workflowName)
                .orElseThrow(() -> new ResourceNotFoundException("Unknown workflow '%s'".formatted(workflowName)));
        Device target = null;
        if (StringUtils.isNotBlank(request.getDeviceId())) {
            target = deviceInventory.findDevice(request.getDeviceId())
                    .orElseThrow(() -> new ComplianceDefinitionException("Unknown device '%s'".formatted(request.getDeviceId())));
        }
        var execution = workflowExecutor.submit(workflow, target, ExecutionRequest.builder()
                .variables(Objects.isNull(request.getVariables()) ? Map.of() : request.getVariables())
                .trigger(Trigger.MANUAL)
                .startedBy(request.getStartedBy())
                .build());
        log.info("Accepted execution {} of workflow '{}'", execution.getId(), workflowName);
        return execution;
    }

    public WorkflowExecution findExecution(final String executionId) {
        return workflowExecutor.findExecution(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Unknown workflow execution '%s'".formatted(executionId)));
    }

    public void cancelExecution(final String executionId) {
        findExecution(executionId);
        if (!workflowExecutor.cancel(executionId)) {
            throw new ResourceConflictException("Workflow execution '%s' has already finished".formatted(executionId));
        }
    }
}
