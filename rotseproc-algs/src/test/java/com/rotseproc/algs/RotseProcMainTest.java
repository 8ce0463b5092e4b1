package com.rotseproc.algs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class RotseProcMainTest {

    @TempDir Path dir;
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    private Path config(String stages) throws Exception {
        Path out = dir.resolve("out");
        Path cfg = dir.resolve("rotse.json");
        Files.writeString(cfg, """
            {
              "program": "supernova",
              "outputDir": "%s",
              "stages": %s
            }
            """.formatted(out.toString().replace("\\", "\\\\"), stages));
        return cfg;
    }

    private static final String COUNT_STAGE = """
        [ { "stage": "count-pixels",
            "params": { "COUNT_REF": 1200, "COUNT_NORMAL_RANGE": [-100, 100], "COUNT_WARN_RANGE": [-300, 300] } } ]
        """;

    @Test
    void usageErrors() {
        assertEquals(RotseProcMain.EXIT_USAGE, RotseProcMain.run(new String[0], err));
        assertEquals(RotseProcMain.EXIT_USAGE, RotseProcMain.run(new String[] {"a.json", "--reference"}, err));
        assertEquals(RotseProcMain.EXIT_USAGE, RotseProcMain.run(new String[] {"a.json", "b.json"}, err));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("usage: RotseProcMain"));
    }

    @Test
    void configurationErrorsAreUsageErrors() throws Exception {
        assertEquals(RotseProcMain.EXIT_USAGE, RotseProcMain.run(new String[] {dir.resolve("missing.json").toString()}, err));

        Path cfg = config("[ { \"stage\": \"count-pixels\" } ]");
        assertEquals(RotseProcMain.EXIT_USAGE, RotseProcMain.run(new String[] {cfg.toString()}, err));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("No parameter is found for stage 'Count_Pixels'"));
    }

    @Test
    void exitCodeIsWorstSeverity() throws Exception {
        // nothing to measure: the metric is NaN and grades ALERT
        Path cfg = config(COUNT_STAGE);

        assertEquals(2, RotseProcMain.run(new String[] {cfg.toString()}, err));

        JsonNode report = new ObjectMapper().readTree(dir.resolve("out/qa/Count_Pixels.json").toFile());
        assertEquals("ALERT", report.get("STATUS").asText());
        assertEquals("NaN", report.get("METRICS").get("COUNT").asText());
    }

    @Test
    void referenceReportFeedsRunReference() throws Exception {
        Path ref = dir.resolve("ref.json");
        Files.writeString(ref, "{ \"METRICS\": { \"COUNT\": \"1210.0\", \"COUNT_PER_IMAGE\": \"[1210.0]\" } }");
        Path cfg = config(COUNT_STAGE);

        assertEquals(2, RotseProcMain.run(new String[] {cfg.toString(), "--reference", ref.toString()}, err));

        Path bogus = dir.resolve("bogus.json");
        Files.writeString(bogus, "{}");
        assertEquals(RotseProcMain.EXIT_USAGE, RotseProcMain.run(new String[] {cfg.toString(), "--reference", bogus.toString()}, err));
    }

    @Test
    void abortedRunExitsThree() throws Exception {
        Path cfg = config("[ { \"stage\": \"coaddition\" } ]");

        // the seed is empty, so coaddition has nothing to work on
        assertEquals(RotseProcMain.EXIT_ABORTED, RotseProcMain.run(new String[] {cfg.toString()}, err));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("No preprocessed images to coadd"));
    }
}
