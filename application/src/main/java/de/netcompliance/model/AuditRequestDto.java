package de.netcompliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Devices and rules of an audit.")
public class AuditRequestDto {

    @NotNull
    @Schema(description = "Ids of the devices to audit.")
    private List<String> deviceIds;
    @NotNull
    @Schema(description = "Ids of the rules to apply.")
    private List<String> ruleIds;
}
