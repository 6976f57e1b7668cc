package de.netcompliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@Schema(description = "An accepted audit.")
public class AuditSubmissionDto {

    @Schema(description = "Id of the audit run.")
    private String runId;
    @Schema(description = "State of the run when it was accepted.")
    private String state;
}
