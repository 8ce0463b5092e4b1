package com.rotseproc.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rotseproc.core.StageContext;
import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JsonReportSinkTest {

    @TempDir Path out;

    private static Report report() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("COUNT_REF", 1200);
        params.put("COUNT_NORMAL_RANGE", List.of(-100, 100));
        params.put("TEMPLATE_DIR", Path.of("/templates"));
        Map<String, String> metrics = new LinkedHashMap<>();
        metrics.put("COUNT", "1210.0");
        metrics.put("COUNT_PER_IMAGE", "[1190.0, 1210.0, 1260.0]");
        return new Report("supernova", "Count_Pixels", params, Severity.WARNING, metrics, Map.of("COUNT", Severity.WARNING));
    }

    @Test
    void writesToDefaultLocation() throws Exception {
        StageContext ctx = StageContext.builder("supernova", "Count_Pixels", out).build();

        new JsonReportSink().write(report(), ctx);

        JsonNode json = new ObjectMapper().readTree(out.resolve("qa/Count_Pixels.json").toFile());
        assertEquals("supernova", json.get("PROGRAM").asText());
        assertEquals("Count_Pixels", json.get("PANAME").asText());
        assertEquals("WARNING", json.get("STATUS").asText());
        assertEquals(1200, json.get("PARAMS").get("COUNT_REF").asInt());
        assertEquals("/templates", json.get("PARAMS").get("TEMPLATE_DIR").asText());
        assertEquals("1210.0", json.get("METRICS").get("COUNT").asText());
        assertEquals("WARNING", json.get("CHECKS").get("COUNT").asText());
    }

    @Test
    void relativeReportPathResolvesAgainstOutputDir() throws Exception {
        StageContext ctx = StageContext.builder("supernova", "Count_Pixels", out).reportPath(Path.of("nested/dir/qa.json")).build();

        new JsonReportSink().write(report(), ctx);

        assertTrue(Files.exists(out.resolve("nested/dir/qa.json")));
    }

    @Test
    void reportReadsBackAsReferenceMetrics() throws Exception {
        StageContext ctx = StageContext.builder("supernova", "Count_Pixels", out).build();
        new JsonReportSink().write(report(), ctx);

        Map<String, Double> refs = ReferenceMetricsReader.read(out.resolve("qa/Count_Pixels.json"));

        assertEquals(Map.of("COUNT", 1210.0), refs);
    }

    @Test
    void readerRejectsReportsWithoutMetrics() throws Exception {
        Path bogus = out.resolve("bogus.json");
        Files.writeString(bogus, "{ \"STATUS\": \"NORMAL\" }");
        assertThrows(java.io.IOException.class, () -> ReferenceMetricsReader.read(bogus));
    }
}
