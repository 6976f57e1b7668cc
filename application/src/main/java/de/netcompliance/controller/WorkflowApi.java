package de.netcompliance.controller;

import de.netcompliance.core.model.WorkflowExecution;
import de.netcompliance.model.ErrorDto;
import de.netcompliance.model.ExecutionRequestDto;
import de.netcompliance.model.ExecutionSubmissionDto;
import de.netcompliance.model.WorkflowSummaryDto;
import de.netcompliance.service.ComplianceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;

@RestController
public class WorkflowApi {

    private final ComplianceService complianceService;

    public WorkflowApi(final ComplianceService complianceService) {
        this.complianceService = complianceService;
    }

    @Operation(
            operationId = "findWorkflows",
            summary = "Lists the workflows available for execution",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Here are the workflows.",
                            content = @Content(
                                    array = @ArraySchema(schema = @Schema(implementation = WorkflowSummaryDto.class)),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    )
            }
    )
    @GetMapping("/workflows")
    public ResponseEntity<List<WorkflowSummaryDto>> findWorkflows() {
        return ResponseEntity.ok(complianceService.findWorkflows());
    }

    @Operation(
            operationId = "startExecution",
            summary = "Starts an execution of a workflow",
            parameters = {
                    @Parameter(
                            name = "name",
                            description = "Name of a workflow.",
                            in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "202",
                            description = "The execution has been accepted.",
                            headers = @Header(name = "location", description = "The location URI of the execution.", schema = @Schema(implementation = URI.class)),
                            content = @Content(
                                    schema = @Schema(implementation = ExecutionSubmissionDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(
                            responseCode = "400",
                            description = "The workflow cannot be executed.",
                            content = @Content(
                                    schema = @Schema(implementation = ErrorDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(
                            responseCode = "404",
                            description = "Workflow not found."
                    )
            }
    )
    @PostMapping("/workflows/{name}/executions")
    public ResponseEntity<ExecutionSubmissionDto> startExecution(@PathVariable("name") final String name,
                                                                 @Valid @RequestBody(required = false) final ExecutionRequestDto request) {
        var execution = complianceService.startExecution(name,
                Objects.isNull(request) ? ExecutionRequestDto.builder().build() : request);
        var locationUri = UriComponentsBuilder
                .fromPath("/workflow-executions/{id}")
                .buildAndExpand(execution.getId())
                .toUri();
        return ResponseEntity.accepted().location(locationUri).body(ExecutionSubmissionDto.builder()
                .executionId(execution.getId())
                .workflowName(execution.getWorkflowName())
                .state(execution.getState().getValue())
                .build());
    }

    @Operation(
            operationId = "findExecution",
            summary = "Returns state and step logs of a workflow execution",
            parameters = {
                    @Parameter(
                            name = "id",
                            description = "Id of a workflow execution.",
                            in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Here is the execution.",
                            content = @Content(
                                    schema = @Schema(implementation = WorkflowExecution.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(
                            responseCode = "404",
                            description = "Execution not found."
                    )
            }
    )
    @GetMapping("/workflow-executions/{id}")
    public ResponseEntity<WorkflowExecution> findExecution(@PathVariable("id") final String id) {
        return ResponseEntity.ok(complianceService.findExecution(id));
    }

    @Operation(
            operationId = "cancelExecution",
            summary = "Cancels the steps of an execution that have not started yet",
            parameters = {
                    @Parameter(
                            name = "id",
                            description = "Id of a workflow execution.",
                            in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(responseCode = "202", description = "Cancellation requested."),
                    @ApiResponse(responseCode = "404", description = "Execution not found."),
                    @ApiResponse(responseCode = "409", description = "Execution already finished.")
            }
    )
    @DeleteMapping("/workflow-executions/{id}")
    public ResponseEntity<Void> cancelExecution(@PathVariable("id") final String id) {
        complianceService.cancelExecution(id);
        return ResponseEntity.accepted().build();
    }
}
