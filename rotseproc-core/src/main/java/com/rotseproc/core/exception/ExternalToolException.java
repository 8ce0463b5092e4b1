package com.rotseproc.core.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * A delegated tool exited non-zero, could not be started, or left its expected outputs missing.
 * Never retried: tools write into shared stage directories and are not safe to re-run blindly.
 */
public class ExternalToolException extends RotseProcException {
    private final List<String> command;
    private final int exitCode;
    private final String expected;
    private final List<Path> found;

    public ExternalToolException(String stageName, List<String> command, int exitCode, String message, Throwable cause) {
        super(stageName, message, cause);
        this.command = command == null ? List.of() : List.copyOf(command);
        this.exitCode = exitCode;
        this.expected = null;
        this.found = List.of();
    }

    private ExternalToolException(String stageName, String expected, List<Path> found) {
        super(stageName, "Stage '" + stageName + "' expected " + expected + " but found " + found);
        this.command = List.of();
        this.exitCode = 0;
        this.expected = expected;
        this.found = List.copyOf(found);
    }

    public static ExternalToolException exited(String stageName, List<String> command, int exitCode) {
        return new ExternalToolException(stageName, command, exitCode,
            "Stage '" + stageName + "' tool exited with " + exitCode + ": " + String.join(" ", command), null);
    }

    public static ExternalToolException missingOutputs(String stageName, String expected, List<Path> found) {
        return new ExternalToolException(stageName, expected, found);
    }

    public List<String> command() {
        return command;
    }

    public int exitCode() {
        return exitCode;
    }

    /** Description of the expected output (directory and pattern), or null for exit failures. */
    public String expected() {
        return expected;
    }

    public List<Path> found() {
        return found;
    }
}
