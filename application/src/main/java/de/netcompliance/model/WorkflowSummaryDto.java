package de.netcompliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@Schema(description = "A workflow definition available for execution.")
public class WorkflowSummaryDto {

    @Schema(description = "Name of the workflow.")
    private String name;
    private String description;
    @Schema(description = "sequential, dag or hybrid.")
    private String executionMode;
    @Schema(description = "Names of the steps in declaration order.")
    private List<String> steps;
}
