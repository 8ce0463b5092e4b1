package com.rotseproc.algs.pa;

import com.rotseproc.algs.io.FitsImage;
import com.rotseproc.core.Artifact;
import com.rotseproc.core.StageContext;
import com.rotseproc.core.exception.ExternalToolException;
import com.rotseproc.core.params.ParameterSchema;
import com.rotseproc.core.params.ParameterType;
import com.rotseproc.core.params.StageParameters;
import com.rotseproc.external.OutputLayout;
import com.rotseproc.external.ToolCommands;
import com.rotseproc.external.Toolchain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs SExtractor over every coadd, saturating at the coadd's {@code SATCNTS}, writing
 * {@code prod/<root>_sobj.fit} and a sky check image. When a {@code calibrate} tool is
 * configured it then turns each {@code _sobj} catalog into a calibrated {@code _cobj} one.
 */
public final class SourceExtraction extends ToolStage {
    private static final Logger log = LoggerFactory.getLogger(SourceExtraction.class);

    static final String DEFAULT_CONFIG_DIR = "/scratch/group/astro/rotse/software/products/idltools/umrotse_idl/tools/sex";

    private static final ParameterSchema SCHEMA = ParameterSchema.builder()
        .optional("SEX_CONFIG_DIR", ParameterType.PATH, DEFAULT_CONFIG_DIR)
        .optional("PHOT_APERTURES", ParameterType.NUMBER, 7)
        .build();

    public SourceExtraction(String name, Toolchain tools) {
        super(name, "Source_Extraction", tools);
    }

    @Override
    public ParameterSchema schema() {
        return SCHEMA;
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        StageParameters p = ctx.parameters().orElseGet(() -> SCHEMA.validate(name(), null));
        Path config = p.path("SEX_CONFIG_DIR");
        String aperture = Idl.number(p.number("PHOT_APERTURES"));
        Path coadd = RotseDirs.coadd(ctx);
        Path prod = OutputLayout.prods(coadd);
        Files.createDirectories(prod);
        boolean calibrate = tools().isConfigured(ToolCommands.CALIBRATE);

        for (Path image : input.files()) {
            String root = root(image.getFileName().toString());
            Path sobj = prod.resolve(root + "_sobj.fit");
            String saturation = FitsImage.readHeader(image).text("SATCNTS");

            tools().run(name(), ToolCommands.SEXTRACTOR, coadd, List.of(
                image.toString(),
                "-c", config.resolve("rotse3.sex").toString(),
                "-PARAMETERS_NAME", config.resolve("rotse3.par").toString(),
                "-FILTER_NAME", config.resolve("gauss_2.0_5x5.conv").toString(),
                "-PHOT_APERTURES", aperture,
                "-SATUR_LEVEL", saturation,
                "-CATALOG_NAME", sobj.toString(),
                "-CHECKIMAGE_NAME", prod.resolve(root + "_sky.fit").toString()));
            requireFile(sobj, prod);

            if (calibrate) {
                tools().run(name(), ToolCommands.CALIBRATE, coadd, image.toString(), sobj.toString());
                requireFile(prod.resolve(root + "_cobj.fit"), prod);
            }
        }
        log.debug("stage={} extracted {} coadds (calibrated={})", name(), input.files().size(), calibrate);
        return input;
    }

    private void requireFile(Path expected, Path dir) throws IOException {
        if (!Files.isRegularFile(expected)) {
            throw ExternalToolException.missingOutputs(name(), expected.toString(), Artifact.list(dir, "*"));
        }
    }

    /** {@code 100927_sks0246+30_3b_000-000_c.fit} has root {@code 100927_sks0246+30_3b_000-000}. */
    static String root(String coaddName) {
        int marker = coaddName.indexOf("000-000");
        if (marker >= 0) return coaddName.substring(0, marker + "000-000".length());
        return FindData.root(coaddName);
    }
}
