package de.netcompliance.infrastructure.netconf;

import de.netcompliance.core.connector.ModelPathTransport;
import de.netcompliance.core.connector.NetconfTransport;
import de.netcompliance.core.connector.PathEdit;
import de.netcompliance.infrastructure.utils.TreePath;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Model-path access carried over NETCONF, the way model-driven devices expose their
 * configuration tree: paths become XPath filters for reads and nested XML for edits.
 */
@Slf4j
public class NetconfModelPathTransport implements ModelPathTransport {

    private static final Pattern UNQUOTED_PREDICATE = Pattern.compile("\\[([^\\]=]+)=([^'\"\\]][^\\]]*)]");

    private static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

    private final NetconfTransport netconf;
    private final String rootNamespace;
    private final String hostname;
    private final AtomicLong messageIds = new AtomicLong();

    public NetconfModelPathTransport(final NetconfTransport netconf, final String rootNamespace, final String hostname) {
        this.netconf = netconf;
        this.rootNamespace = rootNamespace;
        this.hostname = hostname;
    }

    @Override
    public Optional<Object> get(final String path) {
        var reply = NetconfReply.parse(netconf.rpc(
                NetconfMessages.getConfigXPath(messageIds.incrementAndGet(), "running", toXPath(path))));
        if (reply.isDataMissing()) return Optional.empty();
        if (reply.hasErrors()) throw reply.toException("get-config " + path, hostname);
        return reply.normalizedData().flatMap(data -> TreePath.select(data, path));
    }

    @Override
    public void apply(final List<PathEdit> edits) {
        for (PathEdit edit : edits) {
            var config = toConfigXml(edit);
            var reply = NetconfReply.parse(netconf.rpc(
                    NetconfMessages.editConfig(messageIds.incrementAndGet(), "candidate", "merge", config)));
            if (reply.hasErrors()) throw reply.toException("edit-config " + edit.path(), hostname);
        }
    }

    @Override
    public void commit(final String comment) {
        if (Objects.nonNull(comment)) log.info("Committing on {}: {}", hostname, comment);
        var reply = NetconfReply.parse(netconf.rpc(NetconfMessages.commit(messageIds.incrementAndGet())));
        if (reply.hasErrors()) throw reply.toException("commit", hostname);
    }

    @Override
    public void discard() {
        var reply = NetconfReply.parse(netconf.rpc(NetconfMessages.discardChanges(messageIds.incrementAndGet())));
        if (reply.hasErrors()) throw reply.toException("discard-changes", hostname);
    }

    @Override
    public void close() {
        try {
            netconf.rpc(NetconfMessages.closeSession(messageIds.incrementAndGet()));
        } finally {
            netconf.close();
        }
    }

    /**
     * {@code /configure/router[router-name=Base]} becomes {@code /configure/router[router-name='Base']}.
     */
    static String toXPath(final String path) {
        return UNQUOTED_PREDICATE.matcher(path).replaceAll("[$1='$2']");
    }

    String toConfigXml(final PathEdit edit) {
        Document document = XmlSupport.newDocument();
        Element root = null;
        Element current = null;
        for (String segment : TreePath.splitSegments(edit.path())) {
            var element = document.createElementNS(rootNamespace, TreePath.segmentName(segment));
            for (Map.Entry<String, String> key : TreePath.predicates(segment)) {
                var keyElement = document.createElementNS(rootNamespace, key.getKey());
                keyElement.setTextContent(key.getValue());
                element.appendChild(keyElement);
            }
            if (Objects.isNull(root)) {
                root = element;
                document.appendChild(root);
            } else {
                current.appendChild(element);
            }
            current = element;
        }
        if (Objects.isNull(current)) {
            throw new IllegalArgumentException("Empty edit path");
        }
        switch (edit.action()) {
            case DELETE -> markOperation(current, "delete");
            case REPLACE -> {
                markOperation(current, "replace");
                appendValue(document, current, edit.value());
            }
            case UPDATE -> appendValue(document, current, edit.value());
        }
        return XmlSupport.toString(root);
    }

    private void markOperation(final Element element, final String operation) {
        element.setAttributeNS(XMLNS_NS, "xmlns:nc", NetconfMessages.BASE_NS);
        element.setAttributeNS(NetconfMessages.BASE_NS, "nc:operation", operation);
    }

    private void appendValue(final Document document, final Element parent, final Object value) {
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, child) -> {
                if (child instanceof List<?> list) {
                    list.forEach(entry -> appendChild(document, parent, key.toString(), entry));
                } else {
                    appendChild(document, parent, key.toString(), child);
                }
            });
        } else if (Objects.nonNull(value)) {
            parent.setTextContent(value.toString());
        }
    }

    private void appendChild(final Document document, final Element parent, final String name, final Object value) {
        var child = document.createElementNS(rootNamespace, name);
        appendValue(document, child, value);
        parent.appendChild(child);
    }
}
