package com.rotseproc.algs.pa;

import com.rotseproc.algs.io.FitsFixtures;
import com.rotseproc.algs.qa.CountPixels;
import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.MetricFigureRenderer;
import com.rotseproc.core.Orchestrator;
import com.rotseproc.core.ReportSink;
import com.rotseproc.core.RunResult;
import com.rotseproc.core.exception.ExternalToolException;
import com.rotseproc.external.ToolInvocation;
import com.rotseproc.external.Toolchain;
import com.rotseproc.qa.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RotsePipelineTest {
    private static final String C1 = "100927_sks0246+30_3b_000-000_c.fit";
    private static final String C2 = "100928_sks0246+30_3b_000-000_c.fit";

    @TempDir Path out;
    private Path templates;
    private Artifact seed;
    private ScriptedTools tools;

    @BeforeEach
    void setUp() throws Exception {
        Path preprocImages = out.resolve("preproc/image");
        ScriptedTools.touch(preprocImages.resolve("100927_sks0246+30_3b_001.fit"));
        ScriptedTools.touch(preprocImages.resolve("100928_sks0246+30_3b_001.fit"));
        seed = Artifact.discover(DataKind.IMAGE_COLLECTION, preprocImages, "*");

        templates = out.resolve("templates");
        ScriptedTools.touch(templates.resolve("090101_sks0246+30_3b_c.fit"));
        ScriptedTools.touch(templates.resolve("090101_sks0246+30_3b_cobj.fit"));
        ScriptedTools.touch(templates.resolve("090101_sks0246+30_3a_c.fit"));

        tools = new ScriptedTools()
            .on("coadd_all", inv -> {
                FitsFixtures.flat(inv.workingDir().resolve(C1), 1000);
                FitsFixtures.flat(inv.workingDir().resolve(C2), 1010);
                return 0;
            })
            .on("sex", inv -> {
                ScriptedTools.touch(Path.of(argAfter(inv, "-CATALOG_NAME")));
                return 0;
            })
            .on("make_rotse3_subimage", inv -> {
                ScriptedTools.touch(inv.workingDir().resolve("100927_sks0246+30_3b_c.fit"));
                ScriptedTools.touch(inv.workingDir().resolve("100928_sks0246+30_3b_c.fit"));
                ScriptedTools.touch(inv.workingDir().resolve("100927_sks0246+30_3b_cobj.fit"));
                return 0;
            })
            .on("difference_all.py", inv -> {
                Path images = Path.of(argAfter(inv, "-i"));
                ScriptedTools.touch(images.resolve("100927_sks0246+30_3b_c_sub.fit"));
                ScriptedTools.touch(images.resolve("100928_sks0246+30_3b_c_sub.fit"));
                return 0;
            })
            .on("run_phot", inv -> {
                String statement = inv.command().get(inv.command().size() - 1);
                // photometry fails on the 28th
                if (!statement.contains("100928")) {
                    Files.writeString(inv.workingDir().resolve(Photometry.LIGHT_CURVE_FILE), "# MJD MAG ERR\n55466.2 16.5 0.05\n");
                }
                return 0;
            });
    }

    private static String argAfter(ToolInvocation inv, String flag) {
        List<String> c = inv.command();
        return c.get(c.indexOf(flag) + 1);
    }

    private static Map<String, Object> countParams() {
        return Map.of("COUNT_REF", 1000, "COUNT_NORMAL_RANGE", List.of(-20, 20), "COUNT_WARN_RANGE", List.of(-100, 100));
    }

    @Test
    void fullChainProducesLightCurve() throws Exception {
        Toolchain tc = tools.toolchain();
        Orchestrator o = Orchestrator.builder("supernova", out)
            .addStage(new Coaddition(null, tc))
            .addStage(new CountPixels(null, ReportSink.DISCARD, MetricFigureRenderer.NONE), countParams())
            .addStage(new SourceExtraction(null, tc), Map.of("SEX_CONFIG_DIR", "/etc/sex"))
            .addStage(new MakeSubimages(null, tc), Map.of("RA", 41.6, "DEC", 30.2, "PIXEL_RADIUS", 300,
                "TEMPLATE_DIR", templates.toString(), "TELESCOPE", "3b"))
            .addStage(new ImageDifferencing(null, tc))
            .addStage(new ChooseRefstars(null, tc), Map.of("RA", 41.6, "DEC", 30.2))
            .addStage(new Photometry(null, tc))
            .build();

        RunResult result = o.execute(seed);

        assertFalse(result.aborted(), () -> String.valueOf(result.failure()));
        assertEquals(List.of("coadd_all", "sex", "sex", "make_rotse3_subimage", "difference_all.py", "rphot",
            "run_phot", "run_phot", "run_phot"), tools.keys());

        assertEquals(1, result.reports().size());
        assertEquals(Severity.NORMAL, result.reports().get(0).status());
        assertEquals("1005.0", result.reports().get(0).metrics().get(CountPixels.COUNT));

        Artifact lc = result.artifact();
        assertEquals(DataKind.LIGHT_CURVE, lc.kind());
        assertEquals(out.resolve("lightcurve.json"), lc.files().get(0));
        assertTrue(Files.exists(out.resolve("lightcurve.json")));
        assertEquals("1", lc.attribute("nights").orElseThrow());
        assertEquals("100927_sks0246+30_3b_c.fit", lc.attribute(ChooseRefstars.TEMPLATE).orElseThrow());

        assertTrue(Files.exists(out.resolve("coadd/image").resolve(C1)));
        assertTrue(Files.exists(out.resolve("coadd/image/090101_sks0246+30_3b_c.fit")));
        assertFalse(Files.exists(out.resolve("coadd/image/090101_sks0246+30_3a_c.fit")), "other telescope");
        assertTrue(Files.exists(out.resolve("coadd/prod/090101_sks0246+30_3b_cobj.fit")));
        assertTrue(Files.exists(out.resolve("sub/prod/100927_sks0246+30_3b_cobj.fit")));
        assertTrue(Files.exists(out.resolve("sub/nophot/100928_sks0246+30_3b_c_sub.fit")));
    }

    @Test
    void commandsCarryStageArguments() throws Exception {
        Toolchain tc = tools.toolchain();
        Orchestrator.builder("supernova", out)
            .addStage(new Coaddition(null, tc))
            .addStage(new SourceExtraction(null, tc), Map.of("SEX_CONFIG_DIR", "/etc/sex"))
            .addStage(new MakeSubimages(null, tc), Map.of("RA", 41.6, "DEC", 30.25, "PIXEL_RADIUS", 300))
            .addStage(new ImageDifferencing(null, tc))
            .addStage(new ChooseRefstars(null, tc), Map.of("RA", 41.6, "DEC", 30.25))
            .build()
            .execute(seed)
            .requireSuccess();

        ToolInvocation coadd = tools.invocations.get(0);
        assertEquals(out.resolve("preproc"), coadd.workingDir());
        assertTrue(coadd.commandLine().contains("coadd_all,['" + out.resolve("preproc/image/100927_sks0246+30_3b_001.fit")));

        ToolInvocation sex = tools.invocations.get(1);
        assertEquals(out.resolve("coadd"), sex.workingDir());
        assertEquals("28000", argAfter(sex, "-SATUR_LEVEL"));
        assertEquals("7", argAfter(sex, "-PHOT_APERTURES"));
        assertEquals(Path.of("/etc/sex/rotse3.sex").toString(), argAfter(sex, "-c"));
        assertEquals(out.resolve("coadd/prod/100927_sks0246+30_3b_000-000_sky.fit").toString(), argAfter(sex, "-CHECKIMAGE_NAME"));

        String subimage = tools.invocations.get(3).command().get(2);
        assertTrue(subimage.endsWith(",racent=41.6,deccent=30.25,pixrad=300"), subimage);

        String rphot = tools.invocations.get(5).command().get(2);
        assertEquals("rphot,data,imlist=file_search('image/100927_sks0246+30_3b_c.fit'),refname=file_search('image/100927_sks0246+30_3b_c.fit'),"
            + "targetra=41.6,targetdec=30.25,/small", rphot);
    }

    @Test
    void toolFailureAbortsTheRun() {
        tools.on("coadd_all", inv -> 1);
        Orchestrator o = Orchestrator.builder("supernova", out)
            .addStage(new Coaddition(null, tools.toolchain()))
            .addStage(new SourceExtraction(null, tools.toolchain()))
            .build();

        RunResult result = o.execute(seed);

        assertTrue(result.aborted());
        ExternalToolException ex = (ExternalToolException) result.error().orElseThrow().exception();
        assertEquals(1, ex.exitCode());
        assertEquals("Coaddition", ex.stageName());
        assertEquals(List.of("coadd_all"), tools.keys());
    }

    @Test
    void missingCoaddsAreReported() {
        tools.on("coadd_all", inv -> 0);
        Orchestrator o = Orchestrator.builder("supernova", out).addStage(new Coaddition(null, tools.toolchain())).build();

        ExternalToolException ex = (ExternalToolException) o.execute(seed).error().orElseThrow().exception();

        assertTrue(ex.expected().endsWith(Coaddition.COADD_GLOB));
        assertTrue(ex.found().isEmpty());
    }

    @Test
    void calibrationRunsWhenConfigured() throws Exception {
        Toolchain tc = tools
            .on("run_cal", inv -> {
                String sobj = inv.command().get(inv.command().size() - 1);
                ScriptedTools.touch(Path.of(sobj.replace("_sobj.fit", "_cobj.fit")));
                return 0;
            })
            .toolchainWith("calibrate", List.of("run_cal"));

        Orchestrator.builder("supernova", out)
            .addStage(new Coaddition(null, tc))
            .addStage(new SourceExtraction(null, tc))
            .build()
            .execute(seed)
            .requireSuccess();

        assertEquals(List.of("coadd_all", "sex", "run_cal", "sex", "run_cal"), tools.keys());
        assertTrue(Files.exists(out.resolve("coadd/prod/100927_sks0246+30_3b_000-000_cobj.fit")));
    }

    @Test
    void sextractorWithoutCatalogFails() {
        tools.on("sex", inv -> 0);
        Orchestrator o = Orchestrator.builder("supernova", out)
            .addStage(new Coaddition(null, tools.toolchain()))
            .addStage(new SourceExtraction(null, tools.toolchain()))
            .build();

        RunResult result = o.execute(seed);

        ExternalToolException ex = (ExternalToolException) result.error().orElseThrow().exception();
        assertEquals("Source_Extraction", ex.stageName());
        assertTrue(ex.expected().endsWith("_sobj.fit"));
    }

    @Test
    void refstarsWithoutSubimagesFails() throws IOException {
        Files.createDirectories(out.resolve("sub/image"));
        ChooseRefstars stage = new ChooseRefstars(null, tools.toolchain());
        Orchestrator o = Orchestrator.builder("supernova", out).addStage(stage, Map.of("RA", 1, "DEC", 2)).build();

        RunResult result = o.execute(seed);

        assertInstanceOf(ExternalToolException.class, result.error().orElseThrow().exception());
        assertTrue(tools.invocations.isEmpty());
    }

    @Test
    void refstarsSkipsNamesWithoutANight() throws IOException {
        ScriptedTools.touch(out.resolve("sub/image/-x1231_c.fit"));
        ScriptedTools.touch(out.resolve("sub/image/100927_sks0246+30_3b_c.fit"));
        ChooseRefstars stage = new ChooseRefstars(null, tools.toolchain());
        Orchestrator o = Orchestrator.builder("supernova", out).addStage(stage, Map.of("RA", 1, "DEC", 2)).build();

        RunResult result = o.execute(seed);

        assertFalse(result.aborted());
        assertEquals("100927_sks0246+30_3b_c.fit", result.artifact().attribute(ChooseRefstars.TEMPLATE).orElseThrow());
    }

    @Test
    void refstarsWithOnlyUndatedNamesFails() throws IOException {
        ScriptedTools.touch(out.resolve("sub/image/-x1231_c.fit"));
        ScriptedTools.touch(out.resolve("sub/image/template_c.fit"));
        ChooseRefstars stage = new ChooseRefstars(null, tools.toolchain());
        Orchestrator o = Orchestrator.builder("supernova", out).addStage(stage, Map.of("RA", 1, "DEC", 2)).build();

        RunResult result = o.execute(seed);

        ExternalToolException ex = (ExternalToolException) result.error().orElseThrow().exception();
        assertEquals("Choose_Refstars", ex.stageName());
        assertEquals(2, ex.found().size());
        assertTrue(tools.invocations.isEmpty());
    }

    @Test
    void photometryWithoutLightCurveFails() throws IOException {
        ScriptedTools.touch(out.resolve("sub/image/100927_x_c_sub.fit"));
        tools.on("run_phot", inv -> 0);
        Orchestrator o = Orchestrator.builder("supernova", out).addStage(new Photometry(null, tools.toolchain())).build();

        RunResult result = o.execute(seed);

        ExternalToolException ex = (ExternalToolException) result.error().orElseThrow().exception();
        assertTrue(ex.expected().endsWith(Photometry.LIGHT_CURVE_FILE));
        assertTrue(Files.exists(out.resolve("sub/nophot/100927_x_c_sub.fit")));
    }
}
