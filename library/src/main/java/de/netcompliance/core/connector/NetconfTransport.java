package de.netcompliance.core.connector;

/**
 * An established NETCONF session: one framed RPC out, one framed reply back.
 */
public interface NetconfTransport extends AutoCloseable {

    String rpc(final String rpcXml);

    @Override
    void close();
}
