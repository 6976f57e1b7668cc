package de.netcompliance.connector;

import de.netcompliance.config.ComplianceProperties;
import de.netcompliance.core.connector.CredentialResolver;
import de.netcompliance.core.connector.Credentials;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.model.Device;

import java.util.Map;
import java.util.Objects;

/**
 * Resolves {@code credential_ref} of a device against {@code netcompliance.credentials}.
 */
public class PropertiesCredentialResolver implements CredentialResolver {

    private final Map<String, ComplianceProperties.Credential> credentials;

    public PropertiesCredentialResolver(final Map<String, ComplianceProperties.Credential> credentials) {
        this.credentials = Map.copyOf(credentials);
    }

    @Override
    public Credentials resolve(final Device device) {
        if (Objects.isNull(device.getCredentialRef())) {
            throw new PermanentConnectorException("Device '%s' has no credential reference".formatted(device.getId()));
        }
        var credential = credentials.get(device.getCredentialRef());
        if (Objects.isNull(credential)) {
            throw new PermanentConnectorException("Unknown credential reference '%s' of device '%s'"
                    .formatted(device.getCredentialRef(), device.getId()));
        }
        return Credentials.builder()
                .username(credential.getUsername())
                .password(credential.getPassword())
                .build();
    }
}
