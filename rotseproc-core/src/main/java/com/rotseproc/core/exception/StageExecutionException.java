package com.rotseproc.core.exception;

/** I/O or other checked failure escaping a stage body. */
public class StageExecutionException extends RotseProcException {
    public StageExecutionException(String stageName, Throwable cause) {
        super(stageName, "Stage '" + stageName + "' failed: " + cause.getMessage(), cause);
    }
}
