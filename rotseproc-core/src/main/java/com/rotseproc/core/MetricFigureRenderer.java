package com.rotseproc.core;

import com.rotseproc.qa.Metric;

import java.io.IOException;
import java.nio.file.Path;

/** Diagnostic figure for a per-item metric. Plotting itself lives outside this project. */
@FunctionalInterface
public interface MetricFigureRenderer {
    MetricFigureRenderer NONE = (stageName, metric, target) -> {};

    void render(String stageName, Metric metric, Path target) throws IOException;
}
