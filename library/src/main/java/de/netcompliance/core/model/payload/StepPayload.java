package de.netcompliance.core.model.payload;

/**
 * Type-specific part of a step, one implementation per step type.
 */
public interface StepPayload {
}
