package com.rotseproc.metrics;

import com.rotseproc.qa.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class SimpleStageMetricsRecorder implements StageMetricsRecorder {
    public static final String STAGE_DURATION = "rotseproc.stage.duration";
    public static final String STAGE_ERRORS = "rotseproc.stage.errors";
    public static final String RUN_ABORTS = "rotseproc.run.aborts";
    public static final String QA_STATUS = "rotseproc.qa.status";

    private final MeterRegistry registry;

    public SimpleStageMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleStageMetricsRecorder(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onStageSuccess(String program, String stageName, long nanos) {
        Timer.builder(STAGE_DURATION)
                .tag("program", program)
                .tag("stage", stageName)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onStageError(String program, String stageName, Throwable t) {
        Counter.builder(STAGE_ERRORS)
                .tag("program", program)
                .tag("stage", stageName)
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public void onAbort(String program, String stageName) {
        Counter.builder(RUN_ABORTS).tag("program", program).tag("stage", stageName).register(registry).increment();
    }

    @Override
    public void onSeverity(String program, String stageName, Severity severity) {
        Counter.builder(QA_STATUS)
                .tag("program", program)
                .tag("stage", stageName)
                .tag("status", severity.name())
                .register(registry)
                .increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }
}
