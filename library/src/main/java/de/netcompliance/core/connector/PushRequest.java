package de.netcompliance.core.connector;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A configuration change. XML devices read {@code configXml}, model-path devices read {@code edits}.
 */
@Value
@Builder(toBuilder = true)
public class PushRequest {
    String configXml;
    @Builder.Default
    String target = "candidate";
    @Builder.Default
    String defaultOperation = "merge";
    @Builder.Default
    List<PathEdit> edits = List.of();
    @Builder.Default
    boolean commit = true;
    String commitComment;
}
