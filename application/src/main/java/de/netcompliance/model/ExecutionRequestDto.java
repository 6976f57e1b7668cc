package de.netcompliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Target and variables of a workflow execution.")
public class ExecutionRequestDto {

    @Schema(description = "Id of the target device; may be omitted for workflows without device steps.")
    private String deviceId;
    @Builder.Default
    @Schema(description = "Values overriding the workflow variables.")
    private Map<String, Object> variables = new LinkedHashMap<>();
    @Schema(description = "Who started the execution.")
    private String startedBy;
}
