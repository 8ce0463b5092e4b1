package com.rotseproc.external;

import com.rotseproc.core.exception.ExternalToolException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ToolchainTest {

    @TempDir Path dir;

    @Test
    void prefixIsPrependedAndRunsInWorkingDir() {
        FakeToolRunner runner = new FakeToolRunner();
        Toolchain tools = new Toolchain(ToolCommands.of(Map.of("idl", List.of("idl", "-e"))), runner);

        tools.run("Coaddition", "idl", dir, "coadd_all,x");

        assertEquals(1, runner.invocations.size());
        ToolInvocation inv = runner.invocations.get(0);
        assertEquals(List.of("idl", "-e", "coadd_all,x"), inv.command());
        assertEquals(dir, inv.workingDir());
    }

    @Test
    void nonZeroExitRaisesWithCommandAndCode() {
        FakeToolRunner runner = new FakeToolRunner().exit("sex", 2);
        Toolchain tools = new Toolchain(ToolCommands.defaults(), runner);

        ExternalToolException ex = assertThrows(ExternalToolException.class,
            () -> tools.run("Source_Extraction", ToolCommands.SEXTRACTOR, dir, "a.fit"));
        assertEquals(2, ex.exitCode());
        assertEquals("Source_Extraction", ex.stageName());
        assertEquals(List.of("sex", "a.fit"), ex.command());
        assertEquals(1, runner.invocations.size(), "no retry");
    }

    @Test
    void unconfiguredToolFailsBeforeRunning() {
        FakeToolRunner runner = new FakeToolRunner();
        Toolchain tools = new Toolchain(ToolCommands.defaults(), runner);

        assertFalse(tools.isConfigured(ToolCommands.CALIBRATE));
        assertThrows(ExternalToolException.class, () -> tools.run("Source_Extraction", ToolCommands.CALIBRATE, dir));
        assertTrue(runner.invocations.isEmpty());
    }

    @Test
    void startFailureAndInterruptAreWrapped() {
        Toolchain failing = new Toolchain(ToolCommands.defaults(), inv -> { throw new IOException("no such file"); });
        ExternalToolException ex = assertThrows(ExternalToolException.class,
            () -> failing.run("Image_Differencing", ToolCommands.DIFFERENCE, dir));
        assertTrue(ex.getCause() instanceof IOException);

        Toolchain interrupted = new Toolchain(ToolCommands.defaults(), inv -> { throw new InterruptedException(); });
        try {
            assertThrows(ExternalToolException.class, () -> interrupted.run("Image_Differencing", ToolCommands.DIFFERENCE, dir));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void timeoutAndLogFileArePassedThrough() {
        FakeToolRunner runner = new FakeToolRunner();
        Toolchain tools = new Toolchain(ToolCommands.defaults(), runner, Duration.ofMinutes(5), dir.resolve("logs"));

        tools.run("Coaddition", ToolCommands.IDL, dir, "x");

        ToolInvocation inv = runner.invocations.get(0);
        assertEquals(Duration.ofMinutes(5), inv.timeout());
        assertEquals(dir.resolve("logs").resolve("Coaddition.log"), inv.logFile());
    }

    @Test
    void overridesReplaceDefaults() {
        ToolCommands cmds = ToolCommands.defaults().with(Map.of("sextractor", List.of("/opt/sex/bin/sex"), "calibrate", List.of("run_cal")));
        assertEquals(List.of("/opt/sex/bin/sex", "-v"), cmds.command("sextractor", List.of("-v")));
        assertTrue(cmds.has("calibrate"));
        assertTrue(cmds.has("idl"));
        assertThrows(IllegalArgumentException.class, () -> ToolCommands.of(Map.of("idl", List.of())));
    }
}
