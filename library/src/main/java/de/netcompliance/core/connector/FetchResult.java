package de.netcompliance.core.connector;

import java.util.Optional;

/**
 * Outcome of a fetch. A missing path is a regular result, not an error.
 */
public final class FetchResult {

    private static final FetchResult NOT_FOUND = new FetchResult(false, null);

    private final boolean found;
    private final Object value;

    private FetchResult(final boolean found, final Object value) {
        this.found = found;
        this.value = value;
    }

    public static FetchResult found(final Object value) {
        return new FetchResult(true, value);
    }

    public static FetchResult notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return found;
    }

    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return found ? "FetchResult[found=%s]".formatted(value) : "FetchResult[notFound]";
    }
}
