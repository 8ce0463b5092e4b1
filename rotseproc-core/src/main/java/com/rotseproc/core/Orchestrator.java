package com.rotseproc.core;

import com.rotseproc.core.exception.ConfigurationException;
import com.rotseproc.core.exception.IncompatibleInputException;
import com.rotseproc.core.observer.NoopRunObserver;
import com.rotseproc.core.observer.RunObserver;
import com.rotseproc.core.params.StageConfig;
import com.rotseproc.core.params.StageParameters;
import com.rotseproc.metrics.SimpleStageMetricsRecorder;
import com.rotseproc.metrics.StageMetricsRecorder;
import com.rotseproc.qa.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs a fixed, ordered list of stages over one artifact.
 *
 * <p>Processing stages replace the main artifact with their output. Monitoring stages see the
 * current artifact, their reports are collected, and the artifact passes on unchanged. The
 * first failing stage aborts the run; already written outputs stay where they are.
 *
 * <p>All configuration is validated in {@link Builder#build()}, before anything executes.
 * A built orchestrator is immutable; concurrent runs are safe as long as each gets its own
 * output directory.
 */
public final class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final String program;
    private final Path outputDir;
    private final DataKind seedKind;
    private final Map<String, Double> referenceMetrics;
    private final StageConfig stageConfig;
    private final List<BoundStage> stages;
    private final RunObserver observer;
    private final StageMetricsRecorder recorder;

    private Orchestrator(Builder b, StageConfig stageConfig, List<BoundStage> stages) {
        this.program = b.program;
        this.outputDir = b.outputDir;
        this.seedKind = b.seedKind;
        this.referenceMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.referenceMetrics));
        this.stageConfig = stageConfig;
        this.stages = List.copyOf(stages);
        this.observer = b.observer;
        this.recorder = b.recorder;
    }

    public static Builder builder(String program, Path outputDir) {
        return new Builder(program, outputDir);
    }

    /**
     * One configured stage: its raw parameter block (null when none was configured) and
     * optional report and figure paths.
     */
    public record StageEntry(Stage<?> stage, Map<String, ?> parameters, Path reportPath, Path figurePath) {
      public StageEntry {
        stage = Objects.requireNonNull(stage, "stage");
      }
    }

    public static final class Builder {
        private final String program;
        private final Path outputDir;
        private DataKind seedKind = DataKind.IMAGE_COLLECTION;
        private Map<String, Double> referenceMetrics = Map.of();
        private RunObserver observer = NoopRunObserver.INSTANCE;
        private StageMetricsRecorder recorder;
        private final List<StageEntry> entries = new ArrayList<>();

        private Builder(String program, Path outputDir) {
            this.program = Objects.requireNonNull(program, "program");
            this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        }

        public Builder seedKind(DataKind kind) { this.seedKind = Objects.requireNonNull(kind, "kind"); return this; }

        public Builder referenceMetrics(Map<String, Double> refs) {
            this.referenceMetrics = refs == null ? Map.of() : refs;
            return this;
        }

        public Builder observer(RunObserver o) { this.observer = o == null ? NoopRunObserver.INSTANCE : o; return this; }
        public Builder recorder(StageMetricsRecorder r) { this.recorder = r; return this; }

        public Builder addStage(Stage<?> stage) { return addStage(new StageEntry(stage, null, null, null)); }

        public Builder addStage(Stage<?> stage, Map<String, ?> parameters) {
            return addStage(new StageEntry(stage, parameters, null, null));
        }

        public Builder addStage(StageEntry entry) {
            entries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        /**
         * Validates every parameter block against its stage's schema and the data-kind chain.
         *
         * @throws ConfigurationException     on a duplicate stage name, a missing, unrecognized or malformed parameter
         * @throws IncompatibleInputException when a stage cannot accept what the stage before it produces
         */
        public Orchestrator build() {
            if (recorder == null) recorder = new SimpleStageMetricsRecorder();

            Set<String> names = new HashSet<>();
            Map<String, Map<String, ?>> blocks = new LinkedHashMap<>();
            List<BoundStage> bound = new ArrayList<>(entries.size());
            DataKind current = seedKind;

            for (int i = 0; i < entries.size(); i++) {
                StageEntry entry = entries.get(i);
                Stage<?> stage = entry.stage();
                String name = stage.name();
                if (!names.add(name)) throw new ConfigurationException(name, null, "Duplicate stage name: " + name);

                StageParameters params = null;
                if (entry.parameters() != null) {
                    params = stage.schema().validate(name, entry.parameters());
                    stage.validate(params);
                    blocks.put(name, entry.parameters());
                } else if (stage.requiresParameterBlock()) {
                    throw new ConfigurationException(name, null, "No parameter is found for stage '" + name + "'; update the configuration file");
                } else {
                    // still enforces required keys for a stage configured without a block
                    params = stage.schema().validate(name, Map.of());
                }

                if (!stage.accepts(current)) throw new IncompatibleInputException(name, stage.inputKind(), current);
                if (stage instanceof ProcessingStage) current = stage.outputKind();

                bound.add(new BoundStage(i, stage, params, entry.reportPath(), entry.figurePath()));
            }
            return new Orchestrator(this, StageConfig.of(blocks), bound);
        }
    }

    private record BoundStage(int index, Stage<?> stage, StageParameters parameters, Path reportPath, Path figurePath) {}

    public RunResult execute(Artifact seed) {
        Objects.requireNonNull(seed, "seed");
        String runId = UUID.randomUUID().toString();
        long runStartNanos = System.nanoTime();
        RunObserver.RunScope scope = observer.onRunStart(program, runId, stages.size());

        Artifact current = seed;
        List<Report> reports = new ArrayList<>();
        List<StageTiming> timings = new ArrayList<>();
        StageError failure = null;

        for (BoundStage bs : stages) {
            Stage<?> stage = bs.stage();
            String stageName = stage.name();
            scope.onStageStart(bs.index(), stageName);

            long stageStartNanos = System.nanoTime();
            boolean succeeded = true;
            long elapsedNanos;
            try {
                if (!stage.accepts(current.kind())) {
                    throw new IncompatibleInputException(stageName, stage.inputKind(), current.kind());
                }
                Object out = stage.execute(current, contextFor(bs, scope));
                if (out instanceof Report report) {
                    reports.add(report);
                    recorder.onSeverity(program, stageName, report.status());
                    scope.onReport(bs.index(), report);
                } else if (out instanceof Artifact next) {
                    current = next;
                } else {
                    throw new IllegalStateException("Stage '" + stageName + "' returned " + out);
                }
            } catch (Exception ex) {
                succeeded = false;
                failure = new StageError(program, bs.index(), stageName, ex);
                recorder.onStageError(program, stageName, ex);
                scope.onStageError(bs.index(), stageName, ex);
                log.debug("abort '{}' at {} due to exception", program, stageName, ex);
            } finally {
                elapsedNanos = System.nanoTime() - stageStartNanos;
                timings.add(new StageTiming(bs.index(), stageName, elapsedNanos, succeeded));
                scope.onStageEnd(bs.index(), stageName, elapsedNanos, succeeded);
                if (succeeded) recorder.onStageSuccess(program, stageName, elapsedNanos);
            }

            if (failure != null) {
                recorder.onAbort(program, stageName);
                break;
            }
        }

        long totalNanos = System.nanoTime() - runStartNanos;
        RunResult result = new RunResult(program, current, reports, failure, timings, totalNanos);
        scope.onRunEnd(!result.aborted(), result.worstSeverity(), totalNanos, failure == null ? null : failure.exception());
        return result;
    }

    private StageContext contextFor(BoundStage bs, RunObserver.RunScope scope) {
        return StageContext.builder(program, bs.stage().name(), outputDir)
            .parameters(bs.parameters())
            .referenceMetrics(referenceMetrics)
            .reportPath(bs.reportPath())
            .figurePath(bs.figurePath())
            .scope(scope)
            .build();
    }

    public String program() { return program; }
    public Path outputDir() { return outputDir; }
    public DataKind seedKind() { return seedKind; }
    public StageConfig stageConfig() { return stageConfig; }
    public StageMetricsRecorder recorder() { return recorder; }
    public int size() { return stages.size(); }

    public List<Stage<?>> stages() {
        List<Stage<?>> out = new ArrayList<>(stages.size());
        for (BoundStage bs : stages) out.add(bs.stage());
        return Collections.unmodifiableList(out);
    }
}
