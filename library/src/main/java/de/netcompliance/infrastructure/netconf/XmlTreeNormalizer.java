package de.netcompliance.infrastructure.netconf;

import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns XML into the vendor-neutral tree: elements with children become maps keyed by local
 * name, repeated siblings become lists, leaves become their trimmed text. Attributes are dropped.
 */
public final class XmlTreeNormalizer {

    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeChildren(final Element parent) {
        var tree = new LinkedHashMap<String, Object>();
        for (Element child : XmlSupport.childElements(parent)) {
            var name = XmlSupport.localName(child);
            var value = normalize(child);
            var existing = tree.get(name);
            // a normalized value is a string or a map, so a list here always means repeated siblings
            if (existing == null) {
                tree.put(name, value);
            } else if (existing instanceof List<?> siblings) {
                ((List<Object>) siblings).add(value);
            } else {
                var siblings = new ArrayList<>();
                siblings.add(existing);
                siblings.add(value);
                tree.put(name, siblings);
            }
        }
        return tree;
    }

    public static Object normalize(final Element element) {
        if (XmlSupport.childElements(element).isEmpty()) {
            return element.getTextContent().trim();
        }
        return normalizeChildren(element);
    }

    private XmlTreeNormalizer() {}
}
