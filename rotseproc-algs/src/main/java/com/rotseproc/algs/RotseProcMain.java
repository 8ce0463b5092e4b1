package com.rotseproc.algs;

import com.rotseproc.algs.io.ConventionalDataLocator;
import com.rotseproc.config.JsonReportSink;
import com.rotseproc.config.PipelineConfigLoader;
import com.rotseproc.config.PipelineDefinition;
import com.rotseproc.config.ReferenceMetricsReader;
import com.rotseproc.core.Artifact;
import com.rotseproc.core.MetricFigureRenderer;
import com.rotseproc.core.Orchestrator;
import com.rotseproc.core.RunResult;
import com.rotseproc.core.exception.RotseProcException;
import com.rotseproc.core.observer.LoggingRunObserver;
import com.rotseproc.external.ProcessToolRunner;
import com.rotseproc.external.ToolCommands;
import com.rotseproc.external.Toolchain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code RotseProcMain <config.json> [--reference <report.json>]}
 *
 * <p>Exit status is the worst report severity (0 normal, 1 warning, 2 alert), 3 when a stage
 * failed and the run aborted, 64 for a usage or configuration error.
 */
public final class RotseProcMain {
    private static final Logger log = LoggerFactory.getLogger(RotseProcMain.class);

    public static final int EXIT_ABORTED = 3;
    public static final int EXIT_USAGE = 64;

    private RotseProcMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    public static int run(String[] args, PrintStream err) {
        Path config = null;
        Path reference = null;
        for (int i = 0; i < args.length; i++) {
            if ("--reference".equals(args[i]) && i + 1 < args.length) {
                reference = Path.of(args[++i]);
            } else if (!args[i].startsWith("--") && config == null) {
                config = Path.of(args[i]);
            } else {
                return usage(err, "unexpected argument: " + args[i]);
            }
        }
        if (config == null) return usage(err, "missing configuration file");

        Orchestrator orchestrator;
        try {
            PipelineDefinition def = PipelineConfigLoader.load(config);
            if (reference != null) def = def.withReferenceMetrics(ReferenceMetricsReader.read(reference));
            Toolchain tools = new Toolchain(ToolCommands.defaults().with(def.tools()), new ProcessToolRunner(),
                def.toolTimeout(), def.outputDir().resolve("logs"));
            orchestrator = PipelineConfigLoader
                .builder(def, RotseStages.registry(tools, new ConventionalDataLocator(), new JsonReportSink(), MetricFigureRenderer.NONE))
                .observer(new LoggingRunObserver())
                .build();
            Files.createDirectories(def.outputDir());
        } catch (IOException | RotseProcException e) {
            err.println("rotseproc: " + e.getMessage());
            return EXIT_USAGE;
        }

        RunResult result = orchestrator.execute(Artifact.empty(orchestrator.seedKind()));
        if (result.aborted()) {
            err.println("rotseproc: " + result.error().map(x -> x.exception().getMessage()).orElse("aborted"));
            return EXIT_ABORTED;
        }
        log.info("program={} reports={} worst={}", result.program(), result.reports().size(), result.worstSeverity());
        return result.worstSeverity().exitCode();
    }

    private static int usage(PrintStream err, String problem) {
        err.println("rotseproc: " + problem);
        err.println("usage: RotseProcMain <config.json> [--reference <report.json>]");
        return EXIT_USAGE;
    }
}
