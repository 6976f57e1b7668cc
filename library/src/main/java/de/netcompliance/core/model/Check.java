package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A single assertion against one configuration path. {@code xpath}/{@code filterXml} apply to
 * {@link Protocol#NETCONF_XML} devices, {@code path}/{@code filter} to {@link Protocol#MODEL_PATH}
 * devices.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Check {
    private String name;
    private String xpath;
    @JsonProperty("filter_xml")
    private String filterXml;
    private String path;
    private Map<String, Object> filter;
    private ComparisonOperator operator;
    private String expected;
    @JsonProperty("success_message")
    private String successMessage;
    @JsonProperty("error_message")
    private String errorMessage;

    public String targetPath(final Protocol protocol) {
        return switch (protocol) {
            case NETCONF_XML -> xpath;
            case MODEL_PATH -> path;
        };
    }

    public Object targetFilter(final Protocol protocol) {
        return switch (protocol) {
            case NETCONF_XML -> filterXml;
            case MODEL_PATH -> filter;
        };
    }
}
