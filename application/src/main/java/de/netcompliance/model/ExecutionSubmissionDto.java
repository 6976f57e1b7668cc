package de.netcompliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@Schema(description = "An accepted workflow execution.")
public class ExecutionSubmissionDto {

    @Schema(description = "Id of the execution.")
    private String executionId;
    @Schema(description = "Name of the executed workflow.")
    private String workflowName;
    @Schema(description = "State of the execution when it was accepted.")
    private String state;
}
