package de.netcompliance.controller;

import de.netcompliance.core.model.AuditRun;
import de.netcompliance.model.AuditRequestDto;
import de.netcompliance.model.AuditSubmissionDto;
import de.netcompliance.model.ErrorDto;
import de.netcompliance.service.ComplianceService;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.servers.Server;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

@OpenAPIDefinition(
        info = @Info(
                description = "An API to audit network devices against compliance rules and to run automation workflows.",
                title = "Network Compliance API"),
        servers = {
                @Server(description = "Local", url = "http://localhost:8080")})
@RestController
@RequestMapping("/audits")
public class AuditApi {

    private final ComplianceService complianceService;

    public AuditApi(final ComplianceService complianceService) {
        this.complianceService = complianceService;
    }

    @Operation(
            operationId = "submitAudit",
            summary = "Starts an audit of devices against rules",
            responses = {
                    @ApiResponse(
                            responseCode = "202",
                            description = "The audit has been accepted.",
                            headers = @Header(name = "location", description = "The location URI of the audit run.", schema = @Schema(implementation = URI.class)),
                            content = @Content(
                                    schema = @Schema(implementation = AuditSubmissionDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(
                            responseCode = "400",
                            description = "The selection of devices and rules cannot be audited.",
                            content = @Content(
                                    schema = @Schema(implementation = ErrorDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    )
            }
    )
    @PostMapping
    public ResponseEntity<AuditSubmissionDto> submitAudit(@Valid @RequestBody final AuditRequestDto request) {
        var runId = complianceService.submitAudit(request);
        var locationUri = UriComponentsBuilder
                .fromPath("/audits/{runId}")
                .buildAndExpand(runId)
                .toUri();
        return ResponseEntity.accepted().location(locationUri).body(AuditSubmissionDto.builder()
                .runId(runId)
                .state("running")
                .build());
    }

    @Operation(
            operationId = "findAuditRun",
            summary = "Returns state, score and findings of an audit run",
            parameters = {
                    @Parameter(
                            name = "runId",
                            description = "Id of an audit run.",
                            in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Here is the audit run.",
                            content = @Content(
                                    schema = @Schema(implementation = AuditRun.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(
                            responseCode = "404",
                            description = "Audit run not found."
                    )
            }
    )
    @GetMapping("/{runId}")
    public ResponseEntity<AuditRun> findAuditRun(@PathVariable("runId") final String runId) {
        return ResponseEntity.ok(complianceService.findAuditRun(runId));
    }

    @Operation(
            operationId = "cancelAuditRun",
            summary = "Cancels the devices of an audit run that have not started yet",
            parameters = {
                    @Parameter(
                            name = "runId",
                            description = "Id of an audit run.",
                            in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(responseCode = "202", description = "Cancellation requested."),
                    @ApiResponse(responseCode = "404", description = "Audit run not found."),
                    @ApiResponse(responseCode = "409", description = "Audit run already finished.")
            }
    )
    @DeleteMapping("/{runId}")
    public ResponseEntity<Void> cancelAuditRun(@PathVariable("runId") final String runId) {
        complianceService.cancelAuditRun(runId);
        return ResponseEntity.accepted().build();
    }
}
