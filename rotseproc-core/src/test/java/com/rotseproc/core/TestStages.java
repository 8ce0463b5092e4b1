package com.rotseproc.core;

import com.rotseproc.core.params.ParameterSchema;
import com.rotseproc.core.params.ParameterType;
import com.rotseproc.qa.Metric;
import com.rotseproc.qa.MetricCheck;
import com.rotseproc.qa.RangeClassifier;
import com.rotseproc.qa.ReferenceMode;
import com.rotseproc.qa.Report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class TestStages {
    private TestStages() {}

    static final DataKind RAW = DataKind.of("raw");

    /** Appends one file name to the artifact and changes its kind. */
    static final class AppendStage extends ProcessingStage {
        final AtomicInteger calls = new AtomicInteger();
        private final String file;

        AppendStage(String name, DataKind in, DataKind out, String file) {
            super(name, "Append", in, out);
            this.file = file;
        }

        @Override
        protected Artifact process(Artifact input, StageContext context) {
            calls.incrementAndGet();
            List<Path> files = new ArrayList<>(input.files());
            files.add(context.outputDir().resolve(file));
            return Artifact.of(outputKind(), files);
        }
    }

    static final class RequiresNightStage extends ProcessingStage {
        RequiresNightStage(String name) {
            super(name, "Requires_Night", DataKind.IMAGE_COLLECTION, DataKind.IMAGE_COLLECTION);
        }

        @Override
        public ParameterSchema schema() {
            return ParameterSchema.builder().required("NIGHT", ParameterType.TEXT).build();
        }

        @Override
        protected Artifact process(Artifact input, StageContext context) {
            return input.withAttribute("night", requireParameters(context).text("NIGHT"));
        }
    }

    static final class FailingStage extends ProcessingStage {
        FailingStage(String name) {
            super(name, "Failing", DataKind.IMAGE_COLLECTION, DataKind.IMAGE_COLLECTION);
        }

        @Override
        protected Artifact process(Artifact input, StageContext context) throws IOException {
            throw new IOException("disk full");
        }
    }

    static final class WrongOutputStage extends ProcessingStage {
        WrongOutputStage() {
            super(null, "Wrong_Output", DataKind.IMAGE_COLLECTION, DataKind.IMAGE_COLLECTION);
        }

        @Override
        protected Artifact process(Artifact input, StageContext context) {
            return Artifact.empty(DataKind.LIGHT_CURVE);
        }
    }

    /** Grades fixed per-item values; COUNT is their median. */
    static final class FixedCountMonitor extends MonitoringStage {
        final AtomicInteger measured = new AtomicInteger();
        private final List<Double> perItem;

        FixedCountMonitor(String name, List<Double> perItem, ReportSink sink, MetricFigureRenderer renderer) {
            super(name, "Count_Fixed", DataKind.IMAGE_COLLECTION,
                List.of(MetricCheck.conventional("COUNT", ReferenceMode.DIFFERENCE)), sink, renderer);
            this.perItem = List.copyOf(perItem);
        }

        @Override
        protected List<Metric> measure(Artifact input, StageContext context) {
            measured.incrementAndGet();
            return List.of(Metric.scalar("COUNT", RangeClassifier.median(perItem)), Metric.vector("COUNT_PER_IMAGE", perItem));
        }
    }

    static final class RecordingSink implements ReportSink {
        final List<Report> reports = new ArrayList<>();
        final List<Path> targets = new ArrayList<>();

        @Override
        public void write(Report report, StageContext context) {
            reports.add(report);
            targets.add(ReportSink.defaultTarget(context, ".json"));
        }
    }

    static final class RecordingRenderer implements MetricFigureRenderer {
        final List<String> rendered = new ArrayList<>();

        @Override
        public void render(String stageName, Metric metric, Path target) {
            rendered.add(stageName + ":" + metric.name() + ":" + target.getFileName());
        }
    }
}
