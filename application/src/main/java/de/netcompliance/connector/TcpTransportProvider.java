package de.netcompliance.connector;

import de.netcompliance.config.ComplianceProperties;
import de.netcompliance.core.connector.Credentials;
import de.netcompliance.core.connector.ModelPathTransport;
import de.netcompliance.core.connector.NetconfTransport;
import de.netcompliance.core.connector.TransportProvider;
import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.Device;
import de.netcompliance.infrastructure.netconf.NetconfModelPathTransport;
import de.netcompliance.infrastructure.netconf.StreamNetconfTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * NETCONF over a plain TCP socket, as offered by lab devices and simulators. Deployments that
 * talk to production devices plug in an SSH based provider; the credentials are meant for that
 * layer and are not sent here.
 */
@Slf4j
public class TcpTransportProvider implements TransportProvider {

    private final ComplianceProperties.Transport properties;

    public TcpTransportProvider(final ComplianceProperties.Transport properties) {
        this.properties = properties;
    }

    @Override
    public NetconfTransport openNetconf(final Device device, final Credentials credentials) {
        var address = new InetSocketAddress(device.getManagementAddress(), device.effectivePort());
        var socket = new Socket();
        try {
            socket.connect(address, (int) properties.getConnectTimeout().toMillis());
            socket.setSoTimeout((int) properties.getReadTimeout().toMillis());
            log.debug("Connected to {} at {}", device.getHostname(), address);
            return StreamNetconfTransport.open(socket.getInputStream(), socket.getOutputStream(), socket, device.getHostname());
        } catch (IOException e) {
            closeQuietly(socket, device);
            throw new TransientConnectorException("Cannot connect to %s at %s: %s"
                    .formatted(device.getHostname(), address, e.getMessage()), e);
        } catch (RuntimeException e) {
            closeQuietly(socket, device);
            throw e;
        }
    }

    @Override
    public ModelPathTransport openModelPath(final Device device, final Credentials credentials) {
        return new NetconfModelPathTransport(openNetconf(device, credentials),
                properties.getModelPathNamespace(), device.getHostname());
    }

    private static void closeQuietly(final Socket socket, final Device device) {
        try {
            socket.close();
        } catch (IOException closeFailure) {
            log.debug("Closing socket to {} failed: {}", device.getHostname(), closeFailure.getMessage());
        }
    }
}
