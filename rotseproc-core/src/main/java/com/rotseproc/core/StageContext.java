package com.rotseproc.core;

import com.rotseproc.core.observer.NoopRunObserver;
import com.rotseproc.core.observer.RunObserver;
import com.rotseproc.core.params.StageParameters;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Run-scoped values handed to a stage at invocation time. Read-only: stages report through
 * {@link #scope()} and return their results, they never write back into the context.
 */
public final class StageContext {
    private final String program;
    private final String stageName;
    private final Path outputDir;
    private final StageParameters parameters;
    private final Map<String, Double> referenceMetrics;
    private final Path reportPath;
    private final Path figurePath;
    private final RunObserver.RunScope scope;

    private StageContext(Builder b) {
        this.program = Objects.requireNonNull(b.program, "program");
        this.stageName = Objects.requireNonNull(b.stageName, "stageName");
        this.outputDir = Objects.requireNonNull(b.outputDir, "outputDir");
        this.parameters = b.parameters;
        this.referenceMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.referenceMetrics));
        this.reportPath = b.reportPath;
        this.figurePath = b.figurePath;
        this.scope = Objects.requireNonNull(b.scope, "scope");
    }

    public static Builder builder(String program, String stageName, Path outputDir) {
        return new Builder(program, stageName, outputDir);
    }

    public String program() { return program; }
    public String stageName() { return stageName; }
    public Path outputDir() { return outputDir; }

    /** Empty when no parameter block was configured for the stage. */
    public Optional<StageParameters> parameters() { return Optional.ofNullable(parameters); }

    public Map<String, Double> referenceMetrics() { return referenceMetrics; }

    public OptionalDouble referenceMetric(String name) {
        Double v = referenceMetrics.get(name);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public Optional<Path> reportPath() { return Optional.ofNullable(reportPath); }
    public Optional<Path> figurePath() { return Optional.ofNullable(figurePath); }
    public RunObserver.RunScope scope() { return scope; }

    public static final class Builder {
        private final String program;
        private final String stageName;
        private final Path outputDir;
        private StageParameters parameters;
        private Map<String, Double> referenceMetrics = Map.of();
        private Path reportPath;
        private Path figurePath;
        private RunObserver.RunScope scope = NoopRunObserver.INSTANCE.onRunStart("", "", 0);

        private Builder(String program, String stageName, Path outputDir) {
            this.program = program;
            this.stageName = stageName;
            this.outputDir = outputDir;
        }

        public Builder parameters(StageParameters p) { this.parameters = p; return this; }

        public Builder referenceMetrics(Map<String, Double> refs) {
            this.referenceMetrics = refs == null ? Map.of() : refs;
            return this;
        }

        public Builder reportPath(Path p) { this.reportPath = p; return this; }
        public Builder figurePath(Path p) { this.figurePath = p; return this; }
        public Builder scope(RunObserver.RunScope s) { this.scope = s; return this; }

        public StageContext build() {
            return new StageContext(this);
        }
    }
}
