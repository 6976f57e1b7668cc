package de.netcompliance.core.connector;

import de.netcompliance.core.model.Device;

public interface TransportProvider {

    NetconfTransport openNetconf(final Device device, final Credentials credentials);

    ModelPathTransport openModelPath(final Device device, final Credentials credentials);
}
