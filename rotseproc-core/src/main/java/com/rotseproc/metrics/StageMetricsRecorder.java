package com.rotseproc.metrics;

import com.rotseproc.qa.Severity;
import io.micrometer.core.instrument.MeterRegistry;

public interface StageMetricsRecorder {
    void onStageSuccess(String program, String stageName, long nanos);
    void onStageError(String program, String stageName, Throwable t);
    void onAbort(String program, String stageName);
    void onSeverity(String program, String stageName, Severity severity);
    MeterRegistry registry();
}
