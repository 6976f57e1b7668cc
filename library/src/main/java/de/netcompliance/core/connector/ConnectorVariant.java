package de.netcompliance.core.connector;

import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Protocol;

public interface ConnectorVariant {

    boolean supports(final Protocol protocol);

    VendorConnector open(final Device device, final Credentials credentials, final TransportProvider transportProvider);
}
