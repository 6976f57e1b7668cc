package de.netcompliance.core.connector.netconf;

import de.netcompliance.core.connector.ConnectorVariant;
import de.netcompliance.core.connector.Credentials;
import de.netcompliance.core.connector.TransportProvider;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Protocol;

public class NetconfConnectorVariant implements ConnectorVariant {

    @Override
    public boolean supports(final Protocol protocol) {
        return protocol == Protocol.NETCONF_XML;
    }

    @Override
    public VendorConnector open(final Device device, final Credentials credentials, final TransportProvider transportProvider) {
        return new NetconfConnector(device, transportProvider.openNetconf(device, credentials));
    }
}
