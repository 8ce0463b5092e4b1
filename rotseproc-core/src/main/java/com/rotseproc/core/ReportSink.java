package com.rotseproc.core;

import com.rotseproc.qa.Report;

import java.io.IOException;
import java.nio.file.Path;

/** Persists monitoring reports somewhere addressable by stage. */
@FunctionalInterface
public interface ReportSink {
    ReportSink DISCARD = (report, context) -> {};

    void write(Report report, StageContext context) throws IOException;

    /** {@code <outputDir>/qa/<stage><extension>} unless the stage configured its own path. */
    static Path defaultTarget(StageContext context, String extension) {
        return context.reportPath()
            .map(p -> p.isAbsolute() ? p : context.outputDir().resolve(p))
            .orElseGet(() -> context.outputDir().resolve("qa").resolve(context.stageName() + extension));
    }
}
