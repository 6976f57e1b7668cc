package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Device {

    public static final int DEFAULT_NETCONF_PORT = 830;

    private String id;
    private String hostname;
    @JsonProperty("address")
    private String managementAddress;
    private Integer port;
    private VendorType vendor;
    private String model;
    @JsonProperty("credential_ref")
    private String credentialRef;
    @JsonProperty("consecutive_failures")
    private int consecutiveFailures;
    @JsonProperty("next_check_due")
    private Instant nextCheckDue;

    public int effectivePort() {
        return Objects.nonNull(port) ? port : DEFAULT_NETCONF_PORT;
    }

    public Protocol protocol() {
        return vendor.getProtocol();
    }

    public boolean isInBackoff(final Instant now) {
        return Objects.nonNull(nextCheckDue) && now.isBefore(nextCheckDue);
    }

    /**
     * Variables a workflow step sees under {@code device.*}. Credentials are never exposed.
     */
    public Map<String, Object> toContext() {
        var context = new LinkedHashMap<String, Object>();
        context.put("id", id);
        context.put("hostname", hostname);
        context.put("address", managementAddress);
        context.put("port", effectivePort());
        context.put("vendor", Objects.nonNull(vendor) ? vendor.getValue() : null);
        context.put("model", model);
        return context;
    }
}
