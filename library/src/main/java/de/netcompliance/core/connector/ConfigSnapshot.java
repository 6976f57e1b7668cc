package de.netcompliance.core.connector;

import de.netcompliance.core.model.Protocol;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Configuration captured before a push, restored by a compensating push.
 */
@Value
@Builder
public class ConfigSnapshot {
    Protocol protocol;
    // XML devices: captured <data> children, and the root elements the change touches
    String configXml;
    @Builder.Default
    List<String> rootElements = List.of();
    // model-path devices: value per edited path, null where the path was absent
    @Builder.Default
    Map<String, Object> pathValues = Map.of();
}
