package de.netcompliance.core.evaluation;

import de.netcompliance.core.model.Finding;

/**
 * Receives findings as they are produced.
 */
@FunctionalInterface
public interface FindingSink {

    /**
     * @return {@code false} once the receiver accepts no more findings; evaluation stops at the
     * next check boundary
     */
    boolean offer(final Finding finding);
}
