package de.netcompliance.core.connector;

import de.netcompliance.core.model.Device;

/**
 * Resolves a device's opaque credential reference. Implementations throw a
 * {@link de.netcompliance.core.exception.PermanentConnectorException} for unknown references.
 */
@FunctionalInterface
public interface CredentialResolver {

    Credentials resolve(final Device device);
}
