package de.netcompliance.core.model;

/**
 * Management protocol family a vendor speaks. Selects the connector variant and which
 * target expression of a check applies.
 */
public enum Protocol {
    /** XML documents over NETCONF, checks target an XPath-like expression. */
    NETCONF_XML,
    /** Model-driven structured container paths, checks target a path plus key/presence filter. */
    MODEL_PATH
}
