package com.rotseproc.external;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;

/** {@link ToolRunner} backed by {@link ProcessBuilder}. */
public final class ProcessToolRunner implements ToolRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessToolRunner.class);

    @Override
    public int run(ToolInvocation invocation) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(invocation.command())
                .directory(invocation.workingDir().toFile())
                .redirectErrorStream(true);
        pb.environment().putAll(invocation.environment());
        if (invocation.logFile() != null) {
            Files.createDirectories(invocation.logFile().toAbsolutePath().getParent());
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(invocation.logFile().toFile()));
        } else {
            pb.redirectOutput(ProcessBuilder.Redirect.INHERIT);
        }

        log.debug("exec cwd={} cmd={}", invocation.workingDir(), invocation.commandLine());
        Process process = pb.start();
        try {
            if (invocation.timeout() == null) return process.waitFor();

            if (!process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Tool did not finish within " + invocation.timeout() + ": " + invocation.commandLine());
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            // a cancelled run must not leave the tool writing into the stage directory
            process.destroyForcibly();
            log.warn("interrupted, killed pid={} cmd={}", process.pid(), invocation.commandLine());
            throw e;
        }
    }
}
