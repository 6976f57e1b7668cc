package de.netcompliance.core.connector;

import java.util.List;
import java.util.Optional;

/**
 * Session towards a model-driven device addressed by structured container paths.
 */
public interface ModelPathTransport extends AutoCloseable {

    /**
     * @return the subtree at {@code path}, empty when the path does not exist
     */
    Optional<Object> get(final String path);

    void apply(final List<PathEdit> edits);

    void commit(final String comment);

    void discard();

    @Override
    void close();
}
