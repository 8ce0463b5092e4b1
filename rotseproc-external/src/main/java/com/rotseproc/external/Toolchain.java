package com.rotseproc.external;

import com.rotseproc.core.exception.ExternalToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What stages use to call out to external tools: resolves the configured command, runs it
 * synchronously and turns every failure into an {@link ExternalToolException}. There are no
 * retries.
 */
public final class Toolchain {
    private static final Logger log = LoggerFactory.getLogger(Toolchain.class);

    private final ToolCommands commands;
    private final ToolRunner runner;
    private final Duration timeout;
    private final Path logDir;

    public Toolchain(ToolCommands commands, ToolRunner runner) {
        this(commands, runner, null, null);
    }

    /**
     * @param timeout per invocation, or null for none
     * @param logDir  directory for per-stage tool logs, or null to inherit the console
     */
    public Toolchain(ToolCommands commands, ToolRunner runner, Duration timeout, Path logDir) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.timeout = timeout;
        this.logDir = logDir;
    }

    public static Toolchain local() {
        return new Toolchain(ToolCommands.defaults(), new ProcessToolRunner());
    }

    public ToolCommands commands() {
        return commands;
    }

    public boolean isConfigured(String tool) {
        return commands.has(tool);
    }

    public void run(String stageName, String tool, Path workingDir, String... args) {
        run(stageName, tool, workingDir, List.of(args));
    }

    public void run(String stageName, String tool, Path workingDir, List<String> args) {
        List<String> command;
        try {
            command = commands.command(tool, args);
        } catch (IllegalArgumentException e) {
            throw new ExternalToolException(stageName, List.of(tool), -1, "Stage '" + stageName + "': " + e.getMessage(), e);
        }
        Path logFile = logDir == null ? null : logDir.resolve(stageName + ".log");
        ToolInvocation invocation = new ToolInvocation(command, workingDir, timeout, Map.of(), logFile);

        int exit;
        try {
            exit = runner.run(invocation);
        } catch (IOException e) {
            throw new ExternalToolException(stageName, command, -1,
                "Stage '" + stageName + "' could not run " + invocation.commandLine() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(stageName, command, -1, "Stage '" + stageName + "' interrupted while waiting for " + tool, e);
        }
        log.debug("stage={} tool={} exit={}", stageName, tool, exit);
        if (exit != 0) throw ExternalToolException.exited(stageName, command, exit);
    }
}
