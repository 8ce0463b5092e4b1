package com.rotseproc.core;

import com.rotseproc.core.exception.StageExecutionException;

import java.io.IOException;

/**
 * A stage that transforms the main artifact, in memory or by driving an external tool and
 * returning the files it produced.
 */
public abstract class ProcessingStage extends AbstractStage<Artifact> {

    protected ProcessingStage(String name, String defaultName, DataKind inputKind, DataKind outputKind) {
        super(name, defaultName, inputKind, outputKind);
    }

    @Override
    public final Artifact execute(Artifact input, StageContext context) {
        requireCompatible(input);
        Artifact out;
        try {
            out = process(input, context);
        } catch (IOException e) {
            throw new StageExecutionException(name(), e);
        }
        if (out == null) throw new IllegalStateException("Stage returned null: " + name());
        if (!out.kind().equals(outputKind())) {
            throw new IllegalStateException("Stage '" + name() + "' declared " + outputKind() + " but produced " + out.kind());
        }
        return out;
    }

    protected abstract Artifact process(Artifact input, StageContext context) throws IOException;
}
