package com.rotseproc.core.exception;

import com.rotseproc.core.StageError;

public class PipelineAbortedException extends RotseProcException {
    private final StageError error;

    public PipelineAbortedException(String program, StageError error) {
        super(error.stageName(), "Pipeline '" + program + "' aborted at stage " + error.stageIndex()
            + " (" + error.stageName() + "): " + error.exception().getMessage(), error.exception());
        this.error = error;
    }

    public StageError error() {
        return error;
    }
}
