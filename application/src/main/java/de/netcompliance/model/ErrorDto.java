package de.netcompliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@Schema(description = "Why a request was rejected.")
public class ErrorDto {

    private int status;
    private String error;
    @Schema(description = "One entry per problem found.")
    private List<String> messages;
}
