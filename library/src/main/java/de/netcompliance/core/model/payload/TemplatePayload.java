package de.netcompliance.core.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplatePayload implements StepPayload {
    private String template;
    @Builder.Default
    @JsonProperty("template_vars")
    private Map<String, Object> templateVars = new LinkedHashMap<>();
    @Builder.Default
    private String format = "text";
    @Builder.Default
    @JsonProperty("vendor_specific")
    private Map<String, VendorTemplate> vendorSpecific = new LinkedHashMap<>();

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VendorTemplate {
        private String template;
        private String format;
    }
}
