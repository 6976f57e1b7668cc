package de.netcompliance.core.connector.modelpath;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.netcompliance.core.connector.ConfigSnapshot;
import de.netcompliance.core.connector.FetchResult;
import de.netcompliance.core.connector.ModelPathTransport;
import de.netcompliance.core.connector.PathEdit;
import de.netcompliance.core.connector.PushRequest;
import de.netcompliance.core.connector.PushResult;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.exception.PermanentConnectorException;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Protocol;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connector for model-driven devices addressed by structured paths and key/presence filters.
 */
@Slf4j
public class ModelPathConnector implements VendorConnector {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Device device;
    private final ModelPathTransport transport;

    public ModelPathConnector(final Device device, final ModelPathTransport transport) {
        this.device = device;
        this.transport = transport;
    }

    @Override
    public Device getDevice() {
        return device;
    }

    @Override
    public FetchResult fetch(final String path, final Object filter) {
        if (Objects.isNull(path) || path.isBlank()) {
            throw new PermanentConnectorException("Model-path fetch on %s needs a path".formatted(device.getHostname()));
        }
        var raw = transport.get(path);
        if (raw.isEmpty()) return FetchResult.notFound();
        return ModelPathFilter.apply(normalize(raw.get()), toFilter(filter))
                .map(FetchResult::found)
                .orElseGet(FetchResult::notFound);
    }

    @Override
    public PushResult push(final PushRequest request) {
        if (request.getEdits().isEmpty()) {
            throw new PermanentConnectorException("Model-path devices need path operations to push");
        }
        transport.apply(request.getEdits());
        if (!request.isCommit()) {
            return PushResult.builder().committed(false).message("Edits staged, not committed").build();
        }
        try {
            transport.commit(request.getCommitComment());
        } catch (ConnectorException e) {
            discardAfterFailure();
            throw e;
        }
        log.info("Committed {} path operation(s) on {}", request.getEdits().size(), device.getHostname());
        return PushResult.builder()
                .committed(true)
                .message("Configuration committed")
                .details(Map.of("operations", request.getEdits().size()))
                .build();
    }

    @Override
    public ConfigSnapshot snapshot(final PushRequest request) {
        var values = new LinkedHashMap<String, Object>();
        request.getEdits().forEach(edit -> values.put(edit.path(), transport.get(edit.path()).orElse(null)));
        return ConfigSnapshot.builder()
                .protocol(Protocol.MODEL_PATH)
                .pathValues(values)
                .build();
    }

    @Override
    public PushResult restore(final ConfigSnapshot snapshot) {
        var edits = new ArrayList<PathEdit>();
        snapshot.getPathValues().forEach((path, value) ->
                edits.add(Objects.isNull(value) ? PathEdit.delete(path) : PathEdit.replace(path, value)));
        discardAfterFailure();
        transport.apply(edits);
        transport.commit("rollback to pre-change configuration");
        log.info("Restored {} path(s) on {}", edits.size(), device.getHostname());
        return PushResult.builder()
                .committed(true)
                .message("Pre-change configuration restored")
                .build();
    }

    @Override
    public void closeSession() {
        transport.close();
    }

    private Object normalize(final Object raw) {
        return MAPPER.convertValue(raw, Object.class);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toFilter(final Object filter) {
        if (Objects.isNull(filter)) return null;
        if (filter instanceof Map<?, ?> map) return (Map<String, Object>) map;
        if (filter instanceof String text && text.isBlank()) return null;
        throw new PermanentConnectorException("Model-path filter must be a key map, got %s"
                .formatted(filter.getClass().getSimpleName()));
    }

    private void discardAfterFailure() {
        try {
            transport.discard();
        } catch (ConnectorException e) {
            log.warn("Discarding staged edits on {} failed: {}", device.getHostname(), e.getMessage());
        }
    }
}
