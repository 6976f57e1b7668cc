package de.netcompliance.core.connector.modelpath;

import de.netcompliance.core.connector.ConnectorVariant;
import de.netcompliance.core.connector.Credentials;
import de.netcompliance.core.connector.TransportProvider;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Protocol;

public class ModelPathConnectorVariant implements ConnectorVariant {

    @Override
    public boolean supports(final Protocol protocol) {
        return protocol == Protocol.MODEL_PATH;
    }

    @Override
    public VendorConnector open(final Device device, final Credentials credentials, final TransportProvider transportProvider) {
        return new ModelPathConnector(device, transportProvider.openModelPath(device, credentials));
    }
}
