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
public class QueryPayload implements StepPayload {
    private String path;
    private String xpath;
    private Map<String, Object> filter;
    @JsonProperty("filter_xml")
    private String filterXml;
    // keyed by vendor tag, e.g. "nokia_sros"
    @Builder.Default
    @JsonProperty("vendor_specific")
    private Map<String, VendorQuery> vendorSpecific = new LinkedHashMap<>();

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VendorQuery {
        private String path;
        private String xpath;
        private Map<String, Object> filter;
        @JsonProperty("filter_xml")
        private String filterXml;
    }
}
