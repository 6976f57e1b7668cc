package de.netcompliance.infrastructure.netconf;

import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.exception.TransientConnectorException;
import lombok.Getter;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed {@code <rpc-reply>}: ok, data, or a list of rpc-errors.
 */
@Getter
public final class NetconfReply {

    private static final Set<String> TRANSIENT_TAGS = Set.of(
            "in-use", "lock-denied", "resource-denied", "rollback-failed");
    private static final String DATA_MISSING = "data-missing";
    private static final String ACCESS_DENIED = "access-denied";

    private final boolean ok;
    private final Element data;
    private final List<RpcError> errors;

    private NetconfReply(final boolean ok, final Element data, final List<RpcError> errors) {
        this.ok = ok;
        this.data = data;
        this.errors = errors;
    }

    public static NetconfReply parse(final String replyXml) {
        var root = XmlSupport.parse(replyXml).getDocumentElement();
        if (!"rpc-reply".equals(XmlSupport.localName(root))) {
            throw new PermanentConnectorException("Expected rpc-reply but got <%s>".formatted(XmlSupport.localName(root)));
        }
        boolean ok = false;
        Element data = null;
        var errors = new ArrayList<RpcError>();
        for (Element child : XmlSupport.childElements(root)) {
            switch (XmlSupport.localName(child)) {
                case "ok" -> ok = true;
                case "data" -> data = child;
                case "rpc-error" -> errors.add(RpcError.of(child));
                default -> {
                    // vendor extensions next to the data are ignored
                }
            }
        }
        return new NetconfReply(ok, data, errors);
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(error -> !"warning".equals(error.severity()));
    }

    public boolean isDataMissing() {
        return errors.stream().anyMatch(error -> DATA_MISSING.equals(error.tag()));
    }

    /**
     * Normalized {@code <data>} content; empty when the reply carries no data or an empty one.
     */
    public Optional<Map<String, Object>> normalizedData() {
        if (Objects.isNull(data)) return Optional.empty();
        var tree = XmlTreeNormalizer.normalizeChildren(data);
        return tree.isEmpty() ? Optional.empty() : Optional.of(tree);
    }

    /**
     * Maps the rpc-errors onto the connector error taxonomy.
     */
    public ConnectorException toException(final String operation, final String hostname) {
        var message = "%s on %s failed: %s".formatted(operation, hostname, errors.stream()
                .map(RpcError::describe)
                .collect(Collectors.joining("; ")));
        boolean allTransient = !errors.isEmpty() && errors.stream().allMatch(error -> TRANSIENT_TAGS.contains(error.tag()));
        if (allTransient) return new TransientConnectorException(message);
        boolean denied = errors.stream().anyMatch(error -> ACCESS_DENIED.equals(error.tag()));
        return denied ? PermanentConnectorException.sessionFailure(message) : new PermanentConnectorException(message);
    }

    public record RpcError(String type, String tag, String severity, String path, String message) {

        static RpcError of(final Element element) {
            String type = null;
            String tag = null;
            String severity = null;
            String path = null;
            String message = null;
            for (Element field : XmlSupport.childElements(element)) {
                var text = field.getTextContent().trim();
                switch (XmlSupport.localName(field)) {
                    case "error-type" -> type = text;
                    case "error-tag" -> tag = text;
                    case "error-severity" -> severity = text;
                    case "error-path" -> path = text;
                    case "error-message" -> message = text;
                    default -> {
                        // error-app-tag and error-info carry nothing we classify on
                    }
                }
            }
            return new RpcError(type, tag, severity, path, message);
        }

        public String describe() {
            var text = new StringBuilder(Objects.toString(tag, "unknown-error"));
            if (Objects.nonNull(message)) text.append(" (").append(message).append(')');
            if (Objects.nonNull(path)) text.append(" at ").append(path);
            return text.toString();
        }
    }
}
