package com.rotseproc.core;

import com.rotseproc.core.exception.ConfigurationException;
import com.rotseproc.core.exception.StageExecutionException;
import com.rotseproc.core.params.ParameterSchema;
import com.rotseproc.core.params.ParameterType;
import com.rotseproc.core.params.StageParameters;
import com.rotseproc.qa.BandSet;
import com.rotseproc.qa.Metric;
import com.rotseproc.qa.MetricCheck;
import com.rotseproc.qa.RangeClassifier;
import com.rotseproc.qa.ReferenceMode;
import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A stage that measures its input, grades the measurements against reference-relative
 * tolerance bands and emits a {@link Report}. The main artifact passes through untouched.
 *
 * <p>Subclasses supply the measurement; the grading is fixed here. For every declared
 * {@link MetricCheck} the reference is taken from the run's reference metrics when present,
 * else from the configured reference parameter, else grading is absolute. Bands are the
 * configured normal range then the warning range; anything outside both is
 * {@link Severity#ALERT}.
 */
public abstract class MonitoringStage extends AbstractStage<Report> {
    private static final Logger log = LoggerFactory.getLogger(MonitoringStage.class);

    private final List<MetricCheck> checks;
    private final ReportSink sink;
    private final MetricFigureRenderer renderer;

    protected MonitoringStage(String name,
                              String defaultName,
                              DataKind inputKind,
                              List<MetricCheck> checks,
                              ReportSink sink,
                              MetricFigureRenderer renderer) {
        super(name, defaultName, inputKind, inputKind);
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks"));
        if (this.checks.isEmpty()) throw new IllegalArgumentException("monitoring stage needs at least one metric check");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /** Additional parameters the measurement needs, beyond the grading keys. */
    protected ParameterSchema extraParameters() {
        return ParameterSchema.empty();
    }

    /** Computes every metric named by the checks, plus any supplementary ones. */
    protected abstract List<Metric> measure(Artifact input, StageContext context) throws IOException;

    public final List<MetricCheck> checks() {
        return checks;
    }

    @Override
    public final ParameterSchema schema() {
        return buildSchema(checks, extraParameters());
    }

    @Override
    public final boolean requiresParameterBlock() {
        return true;
    }

    @Override
    public void validate(StageParameters parameters) {
        for (MetricCheck check : checks) {
            modeFor(check, parameters);
            bandsFor(check, parameters);
        }
    }

    @Override
    public final Report execute(Artifact input, StageContext context) {
        requireCompatible(input);
        StageParameters params = requireParameters(context);

        List<Metric> metrics;
        try {
            metrics = measure(input, context);
        } catch (IOException e) {
            throw new StageExecutionException(name(), e);
        }
        Map<String, Metric> byName = new LinkedHashMap<>();
        for (Metric m : metrics) byName.put(m.name(), m);

        Map<String, Severity> graded = new LinkedHashMap<>();
        for (MetricCheck check : checks) {
            Metric metric = byName.get(check.metric());
            if (metric == null) throw new IllegalStateException("Stage '" + name() + "' did not compute metric " + check.metric());
            OptionalDouble reference = resolveReference(check, params, context);
            Severity severity = RangeClassifier.classify(metric, reference, modeFor(check, params), bandsFor(check, params));
            log.debug("stage={} metric={} value={} reference={} severity={}",
                name(), check.metric(), metric.representative(), reference, severity);
            graded.put(check.metric(), severity);
        }

        Map<String, String> text = new LinkedHashMap<>();
        for (Metric m : metrics) text.put(m.name(), m.asText());
        Report report = new Report(context.program(), name(), params.snapshot(), Severity.worstOf(graded.values()), text, graded);

        try {
            sink.write(report, context);
            for (Metric m : metrics) {
                if (m.vector()) renderer.render(name(), m, figureTarget(context, m));
            }
        } catch (IOException e) {
            throw new StageExecutionException(name(), e);
        }
        return report;
    }

    private OptionalDouble resolveReference(MetricCheck check, StageParameters params, StageContext context) {
        OptionalDouble fromRun = context.referenceMetric(check.metric());
        if (fromRun.isPresent()) return fromRun;
        if (check.referenceKey() != null) {
            OptionalDouble configured = params.optionalNumber(check.referenceKey());
            if (configured.isPresent()) return configured;
        }
        context.scope().note(name(), "no reference for " + check.metric() + ", grading in absolute mode");
        return OptionalDouble.empty();
    }

    private ReferenceMode modeFor(MetricCheck check, StageParameters params) {
        String key = modeKey(check);
        String raw = params.optionalText(key).orElse(null);
        if (raw == null) return check.mode();
        try {
            return ReferenceMode.parse(raw);
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.invalid(name(), key, e.getMessage());
        }
    }

    private BandSet bandsFor(MetricCheck check, StageParameters params) {
        return BandSet.nested(params.interval(check.normalRangeKey()), params.interval(check.warnRangeKey()));
    }

    private Path figureTarget(StageContext context, Metric metric) {
        return context.figurePath()
            .map(p -> p.isAbsolute() ? p : context.outputDir().resolve(p))
            .orElseGet(() -> context.outputDir().resolve("qa").resolve(name() + "_" + metric.name().toLowerCase(Locale.ROOT) + ".png"));
    }

    private static String modeKey(MetricCheck check) {
        return check.metric() + "_REFERENCE_MODE";
    }

    private static ParameterSchema buildSchema(List<MetricCheck> checks, ParameterSchema extra) {
        ParameterSchema.Builder b = ParameterSchema.builder();
        for (MetricCheck check : checks) {
            if (check.referenceKey() != null) b.optional(check.referenceKey(), ParameterType.NUMBER);
            b.required(check.normalRangeKey(), ParameterType.INTERVAL);
            b.required(check.warnRangeKey(), ParameterType.INTERVAL);
            b.optional(modeKey(check), ParameterType.TEXT);
        }
        return b.include(extra).build();
    }
}
