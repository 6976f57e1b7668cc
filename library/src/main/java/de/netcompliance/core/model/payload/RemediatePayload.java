package de.netcompliance.core.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemediatePayload implements StepPayload {
    @JsonProperty("config_source")
    private Object configSource;
    @JsonProperty("rollback_on_error")
    private boolean rollbackOnError;
    @Builder.Default
    @JsonProperty("vendor_specific")
    private Map<String, VendorRemediation> vendorSpecific = new LinkedHashMap<>();

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VendorRemediation {
        @Builder.Default
        private String target = "candidate";
        @Builder.Default
        @JsonProperty("default_operation")
        private String defaultOperation = "merge";
        private String path;
        @Builder.Default
        private List<PathOperation> operations = new ArrayList<>();
        @Builder.Default
        private boolean commit = true;
        @JsonProperty("commit_comment")
        private String commitComment;
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PathOperation {
        private String path;
        @Builder.Default
        private String action = "update";
        private Object value;
    }
}
