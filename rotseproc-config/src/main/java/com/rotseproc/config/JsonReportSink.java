package com.rotseproc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rotseproc.core.ReportSink;
import com.rotseproc.core.StageContext;
import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each report as a pretty-printed JSON object with the keys {@code PROGRAM},
 * {@code PANAME}, {@code PARAMS}, {@code STATUS}, {@code METRICS} and {@code CHECKS}.
 */
public final class JsonReportSink implements ReportSink {
    private static final Logger log = LoggerFactory.getLogger(JsonReportSink.class);
    private static final ObjectMapper M = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void write(Report report, StageContext context) throws IOException {
        Path target = ReportSink.defaultTarget(context, ".json");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        M.writeValue(target.toFile(), toJson(report));
        log.debug("wrote report stage={} status={} to {}", report.stageName(), report.status(), target);
    }

    static ObjectNode toJson(Report report) {
        ObjectNode root = M.createObjectNode();
        root.put("PROGRAM", report.program());
        root.put("PANAME", report.stageName());
        root.set("PARAMS", M.valueToTree(stringifyPaths(report.parameters())));
        root.put("STATUS", report.status().name());
        ObjectNode metrics = root.putObject("METRICS");
        report.metrics().forEach(metrics::put);
        ObjectNode checks = root.putObject("CHECKS");
        for (Map.Entry<String, Severity> e : report.checks().entrySet()) checks.put(e.getKey(), e.getValue().name());
        return root;
    }

    private static Map<String, Object> stringifyPaths(Map<String, Object> params) {
        Map<String, Object> out = new LinkedHashMap<>();
        params.forEach((k, v) -> out.put(k, v instanceof Path p ? p.toString() : v));
        return out;
    }
}
