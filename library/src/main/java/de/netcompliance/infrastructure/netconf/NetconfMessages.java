package de.netcompliance.infrastructure.netconf;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds NETCONF 1.0 protocol operations.
 */
public final class NetconfMessages {

    public static final String BASE_NS = "urn:ietf:params:xml:ns:netconf:base:1.0";
    public static final String CAPABILITY_BASE_10 = "urn:ietf:params:netconf:base:1.0";
    public static final String CAPABILITY_BASE_11 = "urn:ietf:params:netconf:base:1.1";

    public static String hello(final List<String> capabilities) {
        var capabilityElements = capabilities.stream()
                .map(capability -> "<capability>%s</capability>".formatted(capability))
                .collect(Collectors.joining());
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <hello xmlns="%s"><capabilities>%s</capabilities></hello>"""
                .formatted(BASE_NS, capabilityElements);
    }

    public static String getConfigSubtree(final long messageId, final String source, final String subtreeFilter) {
        var filter = Objects.isNull(subtreeFilter) || subtreeFilter.isBlank()
                ? ""
                : "<filter type=\"subtree\">%s</filter>".formatted(subtreeFilter);
        return rpc(messageId, "<get-config><source><%s/></source>%s</get-config>".formatted(source, filter));
    }

    public static String getConfigXPath(final long messageId, final String source, final String xpath) {
        return rpc(messageId, "<get-config><source><%s/></source><filter type=\"xpath\" select=\"%s\"/></get-config>"
                .formatted(source, XmlSupport.escape(xpath)));
    }

    public static String editConfig(final long messageId,
                                    final String target,
                                    final String defaultOperation,
                                    final String configXml) {
        var operation = Objects.isNull(defaultOperation)
                ? ""
                : "<default-operation>%s</default-operation>".formatted(defaultOperation);
        return rpc(messageId, "<edit-config><target><%s/></target>%s%s</edit-config>"
                .formatted(target, operation, wrapConfig(configXml)));
    }

    public static String commit(final long messageId) {
        return rpc(messageId, "<commit/>");
    }

    public static String discardChanges(final long messageId) {
        return rpc(messageId, "<discard-changes/>");
    }

    public static String closeSession(final long messageId) {
        return rpc(messageId, "<close-session/>");
    }

    /**
     * Wraps configuration in {@code <config>} unless the author already did.
     */
    public static String wrapConfig(final String configXml) {
        var trimmed = configXml.trim();
        if (trimmed.startsWith("<config") || trimmed.startsWith("<nc:config")) return trimmed;
        return "<config xmlns=\"%s\">%s</config>".formatted(BASE_NS, trimmed);
    }

    private static String rpc(final long messageId, final String operation) {
        return "<rpc message-id=\"%d\" xmlns=\"%s\">%s</rpc>".formatted(messageId, BASE_NS, operation);
    }

    private NetconfMessages() {}
}
