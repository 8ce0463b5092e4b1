package com.rotseproc.core;

import com.rotseproc.core.exception.ConfigurationException;
import com.rotseproc.core.exception.IncompatibleInputException;
import com.rotseproc.core.params.StageParameters;

import java.util.Objects;

/** Name defaulting and the input gate common to both stage variants. */
public abstract class AbstractStage<R> implements Stage<R> {
    private final String name;
    private final DataKind inputKind;
    private final DataKind outputKind;

    protected AbstractStage(String name, String defaultName, DataKind inputKind, DataKind outputKind) {
        this.name = (name == null || name.isBlank()) ? Objects.requireNonNull(defaultName, "defaultName") : name;
        this.inputKind = Objects.requireNonNull(inputKind, "inputKind");
        this.outputKind = Objects.requireNonNull(outputKind, "outputKind");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final DataKind inputKind() {
        return inputKind;
    }

    @Override
    public final DataKind outputKind() {
        return outputKind;
    }

    protected final void requireCompatible(Artifact input) {
        Objects.requireNonNull(input, "input");
        if (!accepts(input.kind())) throw new IncompatibleInputException(name, inputKind, input.kind());
    }

    /** The stage's parameter block, or a {@link ConfigurationException} when none was configured. */
    protected final StageParameters requireParameters(StageContext context) {
        return context.parameters().orElseThrow(() -> new ConfigurationException(name, null,
            "No parameter is found for stage '" + name + "'; update the configuration file"));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ": " + inputKind + " -> " + outputKind + "]";
    }
}
