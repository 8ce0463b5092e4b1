package com.rotseproc.core;

import com.rotseproc.core.params.ParameterSchema;
import com.rotseproc.core.params.StageParameters;

/**
 * Capability shared by every pipeline stage: one accepted and one produced {@link DataKind},
 * a declared parameter schema, and a uniform entry point.
 *
 * <p>Callers check {@link #accepts(DataKind)} before {@link #execute}; implementations still
 * reject a mismatched input with {@link com.rotseproc.core.exception.IncompatibleInputException}
 * before any side effect.
 *
 * @param <R> result type; {@link Artifact} for processing stages, a report for monitoring stages
 */
public interface Stage<R> {
    String name();

    DataKind inputKind();

    DataKind outputKind();

    default ParameterSchema schema() {
        return ParameterSchema.empty();
    }

    /** Whether running without any parameter block is a configuration error. */
    default boolean requiresParameterBlock() {
        return false;
    }

    /** Cross-field checks run once at pipeline-build time, after schema validation. */
    default void validate(StageParameters parameters) {}

    default boolean accepts(DataKind candidate) {
        return inputKind().equals(candidate);
    }

    R execute(Artifact input, StageContext context);
}
