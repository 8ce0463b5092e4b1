package com.rotseproc.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Reads the scalar metrics of a report written by {@link JsonReportSink} for use as reference metrics. */
public final class ReferenceMetricsReader {
    private static final ObjectMapper M = new ObjectMapper();

    private ReferenceMetricsReader() {}

    /** Numeric entries of {@code METRICS}; collection-valued metrics, rendered as {@code [a, b, ...]}, are skipped. */
    public static Map<String, Double> read(Path report) throws IOException {
        JsonNode root = M.readTree(report.toFile());
        JsonNode metrics = root == null ? null : root.get("METRICS");
        if (metrics == null || !metrics.isObject()) throw new IOException("No METRICS object in " + report);

        Map<String, Double> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = metrics.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v.isNumber()) {
                out.put(e.getKey(), v.asDouble());
            } else if (v.isTextual() && !v.asText().trim().startsWith("[")) {
                try {
                    out.put(e.getKey(), Double.parseDouble(v.asText().trim()));
                } catch (NumberFormatException ex) {
                    throw new IOException("Metric '" + e.getKey() + "' in " + report + " is not numeric: " + v.asText(), ex);
                }
            }
        }
        return out;
    }
}
