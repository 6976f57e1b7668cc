package de.netcompliance.infrastructure.netconf;

import de.netcompliance.core.connector.NetconfTransport;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.exception.TransientConnectorException;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * NETCONF session over an already established byte stream (SSH subsystem channel, TCP or TLS
 * socket). Performs the hello exchange and switches to chunked framing when both peers
 * announce base:1.1.
 */
@Slf4j
public class StreamNetconfTransport implements NetconfTransport {

    private final InputStream in;
    private final OutputStream out;
    private final Closeable resource;
    private final String peer;
    private NetconfFraming.Mode mode = NetconfFraming.Mode.END_OF_MESSAGE;
    private boolean closed;

    StreamNetconfTransport(final InputStream in, final OutputStream out, final Closeable resource, final String peer) {
        this.in = in;
        this.out = out;
        this.resource = resource;
        this.peer = peer;
    }

    public static StreamNetconfTransport open(final InputStream in,
                                              final OutputStream out,
                                              final Closeable resource,
                                              final String peer) {
        var transport = new StreamNetconfTransport(in, out, resource, peer);
        transport.exchangeHello();
        return transport;
    }

    @Override
    public synchronized String rpc(final String rpcXml) {
        if (closed) throw new TransientConnectorException("NETCONF session to %s is closed".formatted(peer));
        try {
            log.debug(">> {}: {}", peer, rpcXml);
            NetconfFraming.write(out, rpcXml, mode);
            var reply = NetconfFraming.read(in, mode);
            log.debug("<< {}: {}", peer, reply);
            return reply;
        } catch (IOException e) {
            throw new TransientConnectorException("NETCONF exchange with %s failed: %s".formatted(peer, e.getMessage()), e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            resource.close();
        } catch (IOException e) {
            log.warn("Closing NETCONF stream to {} failed: {}", peer, e.getMessage());
        }
    }

    public NetconfFraming.Mode getMode() {
        return mode;
    }

    private void exchangeHello() {
        try {
            NetconfFraming.write(out, NetconfMessages.hello(List.of(
                    NetconfMessages.CAPABILITY_BASE_10,
                    NetconfMessages.CAPABILITY_BASE_11)), NetconfFraming.Mode.END_OF_MESSAGE);
            var serverHello = NetconfFraming.read(in, NetconfFraming.Mode.END_OF_MESSAGE);
            var root = XmlSupport.parse(serverHello.trim()).getDocumentElement();
            if (!"hello".equals(XmlSupport.localName(root))) {
                throw PermanentConnectorException.sessionFailure("%s did not answer with <hello>".formatted(peer));
            }
            if (serverHello.contains(NetconfMessages.CAPABILITY_BASE_11)) {
                mode = NetconfFraming.Mode.CHUNKED;
            }
            log.debug("NETCONF session to {} established, framing {}", peer, mode);
        } catch (RuntimeException e) {
            close();
            throw e;
        } catch (IOException e) {
            close();
            throw new TransientConnectorException("NETCONF hello with %s failed: %s".formatted(peer, e.getMessage()), e);
        }
    }
}
