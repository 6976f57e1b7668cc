package de.netcompliance.core.connector;

import de.netcompliance.core.model.Device;

/**
 * Vendor-neutral access to one device session.
 * <p>
 * Every fetched value is normalized to maps, lists and string leaves. A path that does not
 * exist yields {@link FetchResult#notFound()}; only transport and authentication failures raise
 * a {@link de.netcompliance.core.exception.ConnectorException}.
 */
public interface VendorConnector {

    Device getDevice();

    FetchResult fetch(final String path, final Object filter);

    PushResult push(final PushRequest request);

    ConfigSnapshot snapshot(final PushRequest request);

    PushResult restore(final ConfigSnapshot snapshot);

    void closeSession();
}
