package de.netcompliance.core.connector;

import de.netcompliance.core.connector.modelpath.ModelPathConnectorVariant;
import de.netcompliance.core.connector.netconf.NetconfConnectorVariant;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.model.Device;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Slf4j
public class ConnectorFactory {

    private final List<ConnectorVariant> variants = new ArrayList<>(
            // register default variants
            List.of(
                    new NetconfConnectorVariant(),
                    new ModelPathConnectorVariant()
            ));
    private final CredentialResolver credentialResolver;
    private final TransportProvider transportProvider;

    public ConnectorFactory(final CredentialResolver credentialResolver, final TransportProvider transportProvider) {
        this.credentialResolver = credentialResolver;
        this.transportProvider = transportProvider;
    }

    /**
     * Registered variants take precedence over the defaults.
     */
    public void register(final ConnectorVariant variant) {
        variants.add(0, variant);
    }

    public VendorConnector open(final Device device) {
        if (Objects.isNull(device.getVendor())) {
            throw new PermanentConnectorException("Device '%s' has no vendor".formatted(device.getId()));
        }
        var protocol = device.protocol();
        var variant = variants.stream()
                .filter(v -> v.supports(protocol))
                .findFirst()
                .orElseThrow(() -> new PermanentConnectorException("No connector for protocol %s".formatted(protocol)));
        var credentials = credentialResolver.resolve(device);
        log.debug("Opening {} session to {} ({}:{})", protocol, device.getHostname(),
                device.getManagementAddress(), device.effectivePort());
        return variant.open(device, credentials, transportProvider);
    }
}
