package de.netcompliance.core.connector.netconf;

import de.netcompliance.core.connector.ConfigSnapshot;
import de.netcompliance.core.connector.FetchResult;
import de.netcompliance.core.connector.NetconfTransport;
import de.netcompliance.core.connector.PushRequest;
import de.netcompliance.core.connector.PushResult;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Protocol;
import de.netcompliance.infrastructure.netconf.NetconfMessages;
import de.netcompliance.infrastructure.netconf.NetconfReply;
import de.netcompliance.infrastructure.netconf.XmlSupport;
import de.netcompliance.infrastructure.utils.TreePath;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Connector for devices managed with NETCONF and XML filters.
 * <p>
 * Reads use {@code get-config} on the running datastore with the check's subtree filter, or with
 * the path itself as XPath filter when no filter is given. Changes are an {@code edit-config}
 * followed by an explicit {@code commit}; a failed edit or commit is discarded.
 */
@Slf4j
public class NetconfConnector implements VendorConnector {

    private static final String RUNNING = "running";

    private final Device device;
    private final NetconfTransport transport;
    private final AtomicLong messageIds = new AtomicLong();

    public NetconfConnector(final Device device, final NetconfTransport transport) {
        this.device = device;
        this.transport = transport;
    }

    @Override
    public Device getDevice() {
        return device;
    }

    @Override
    public FetchResult fetch(final String path, final Object filter) {
        if (Objects.nonNull(filter) && !(filter instanceof String)) {
            throw new PermanentConnectorException("XML devices take an XML subtree filter, got %s"
                    .formatted(filter.getClass().getSimpleName()));
        }
        var filterXml = (String) filter;
        String request;
        if (Objects.nonNull(filterXml) && !filterXml.isBlank()) {
            request = NetconfMessages.getConfigSubtree(messageIds.incrementAndGet(), RUNNING, filterXml);
        } else if (Objects.nonNull(path) && !path.isBlank()) {
            request = NetconfMessages.getConfigXPath(messageIds.incrementAndGet(), RUNNING, path);
        } else {
            throw new PermanentConnectorException("Neither path nor filter given for %s".formatted(device.getHostname()));
        }

        var reply = NetconfReply.parse(transport.rpc(request));
        if (reply.isDataMissing()) return FetchResult.notFound();
        if (reply.hasErrors()) throw reply.toException("get-config", device.getHostname());

        var data = reply.normalizedData();
        if (data.isEmpty()) return FetchResult.notFound();
        if (Objects.isNull(path) || path.isBlank()) return FetchResult.found(data.get());
        return TreePath.select(data.get(), path)
                .map(FetchResult::found)
                .orElseGet(FetchResult::notFound);
    }

    @Override
    public PushResult push(final PushRequest request) {
        if (Objects.isNull(request.getConfigXml()) || request.getConfigXml().isBlank()) {
            throw new PermanentConnectorException("XML devices need configuration XML to push");
        }
        var editReply = NetconfReply.parse(transport.rpc(NetconfMessages.editConfig(
                messageIds.incrementAndGet(), request.getTarget(), request.getDefaultOperation(), request.getConfigXml())));
        if (editReply.hasErrors()) {
            discardQuietly(request.getTarget());
            throw editReply.toException("edit-config", device.getHostname());
        }
        if (!request.isCommit() || !"candidate".equals(request.getTarget())) {
            return PushResult.builder()
                    .committed(false)
                    .message("Configuration applied to %s datastore".formatted(request.getTarget()))
                    .build();
        }
        commit();
        log.info("Committed configuration on {}{}", device.getHostname(),
                Objects.nonNull(request.getCommitComment()) ? " (" + request.getCommitComment() + ")" : "");
        return PushResult.builder()
                .committed(true)
                .message("Configuration committed")
                .details(Map.of("target", request.getTarget()))
                .build();
    }

    @Override
    public ConfigSnapshot snapshot(final PushRequest request) {
        var roots = rootElementsOf(request.getConfigXml());
        var filter = roots.stream()
                .map(this::emptyCopy)
                .collect(Collectors.joining());
        var reply = NetconfReply.parse(transport.rpc(
                NetconfMessages.getConfigSubtree(messageIds.incrementAndGet(), RUNNING, filter)));
        if (reply.hasErrors() && !reply.isDataMissing()) throw reply.toException("get-config", device.getHostname());

        var captured = Objects.isNull(reply.getData())
                ? ""
                : XmlSupport.childElements(reply.getData()).stream()
                        .map(XmlSupport::toString)
                        .collect(Collectors.joining());
        return ConfigSnapshot.builder()
                .protocol(Protocol.NETCONF_XML)
                .configXml(captured)
                .rootElements(roots.stream().map(this::emptyCopy).toList())
                .build();
    }

    @Override
    public PushResult restore(final ConfigSnapshot snapshot) {
        discardQuietly("candidate");
        var restoreXml = snapshot.getConfigXml().isBlank()
                ? snapshot.getRootElements().stream().map(root -> withOperation(root, "remove")).collect(Collectors.joining())
                : XmlSupport.parseFragment(snapshot.getConfigXml()).stream()
                        .map(element -> withOperation(XmlSupport.toString(element), "replace"))
                        .collect(Collectors.joining());
        var reply = NetconfReply.parse(transport.rpc(NetconfMessages.editConfig(
                messageIds.incrementAndGet(), "candidate", "none", restoreXml)));
        if (reply.hasErrors()) throw reply.toException("edit-config (restore)", device.getHostname());
        commit();
        log.info("Restored pre-change configuration on {}", device.getHostname());
        return PushResult.builder()
                .committed(true)
                .message("Pre-change configuration restored")
                .build();
    }

    @Override
    public void closeSession() {
        try {
            var reply = NetconfReply.parse(transport.rpc(NetconfMessages.closeSession(messageIds.incrementAndGet())));
            if (reply.hasErrors()) {
                log.warn("close-session on {} answered with errors: {}", device.getHostname(), reply.getErrors());
            }
        } finally {
            transport.close();
        }
    }

    private void commit() {
        var reply = NetconfReply.parse(transport.rpc(NetconfMessages.commit(messageIds.incrementAndGet())));
        if (reply.hasErrors()) {
            discardQuietly("candidate");
            throw reply.toException("commit", device.getHostname());
        }
    }

    private void discardQuietly(final String target) {
        if (!"candidate".equals(target)) return;
        try {
            var reply = NetconfReply.parse(transport.rpc(NetconfMessages.discardChanges(messageIds.incrementAndGet())));
            if (reply.hasErrors()) {
                log.warn("discard-changes on {} failed: {}", device.getHostname(), reply.getErrors());
            }
        } catch (ConnectorException e) {
            log.warn("discard-changes on {} failed: {}", device.getHostname(), e.getMessage());
        }
    }

    private List<Element> rootElementsOf(final String configXml) {
        if (Objects.isNull(configXml) || configXml.isBlank()) {
            throw new PermanentConnectorException("Nothing to snapshot without configuration XML");
        }
        var elements = XmlSupport.parseFragment(configXml);
        var roots = new ArrayList<Element>();
        for (Element element : elements) {
            // unwrap an explicit <config> element
            if ("config".equals(XmlSupport.localName(element))) {
                roots.addAll(XmlSupport.childElements(element));
            } else {
                roots.add(element);
            }
        }
        return roots;
    }

    private String emptyCopy(final Element element) {
        var namespace = element.getNamespaceURI();
        var name = XmlSupport.localName(element);
        return Objects.isNull(namespace)
                ? "<%s/>".formatted(name)
                : "<%s xmlns=\"%s\"/>".formatted(name, namespace);
    }

    private String withOperation(final String elementXml, final String operation) {
        var element = XmlSupport.parseFragment(elementXml).get(0);
        element.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:nc", NetconfMessages.BASE_NS);
        element.setAttributeNS(NetconfMessages.BASE_NS, "nc:operation", operation);
        return XmlSupport.toString(element);
    }
}
