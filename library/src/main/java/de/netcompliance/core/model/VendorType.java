package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum VendorType {
    CISCO_XR("cisco_xr", Protocol.NETCONF_XML),
    CISCO_XE("cisco_xe", Protocol.NETCONF_XML),
    JUNIPER_JUNOS("juniper_junos", Protocol.NETCONF_XML),
    ARISTA_EOS("arista_eos", Protocol.NETCONF_XML),
    NOKIA_SROS("nokia_sros", Protocol.MODEL_PATH);

    @JsonValue
    private final String value;
    private final Protocol protocol;

    @JsonCreator
    public static VendorType of(final String value) {
        for (VendorType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown vendor '%s'".formatted(value));
    }
}
