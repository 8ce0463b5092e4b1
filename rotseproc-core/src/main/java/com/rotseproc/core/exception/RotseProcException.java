package com.rotseproc.core.exception;

/** Root of the pipeline's failure taxonomy. */
public class RotseProcException extends RuntimeException {
    private final String stageName;

    public RotseProcException(String stageName, String message) {
        super(message);
        this.stageName = stageName;
    }

    public RotseProcException(String stageName, String message, Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
    }

    /** Stage the failure belongs to, or null when raised outside a stage. */
    public String stageName() {
        return stageName;
    }
}
