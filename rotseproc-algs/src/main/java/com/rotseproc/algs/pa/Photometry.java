package com.rotseproc.algs.pa;

import com.rotseproc.algs.io.LightCurve;
import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
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
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Runs IDL {@code run_phot} night by night to weed out difference images photometry fails on
 * (they are moved to {@code sub/nophot}), then once over all remaining ones, and writes the
 * resulting light curve as JSON.
 */
public final class Photometry extends ToolStage {
    private static final Logger log = LoggerFactory.getLogger(Photometry.class);

    static final String LIGHT_CURVE_FILE = "lightcurve_subtract_target_psf.dat";

    private static final ParameterSchema SCHEMA = ParameterSchema.builder()
        .optional("DUMP_FILE", ParameterType.PATH, "lightcurve.json")
        .build();

    public Photometry(String name, Toolchain tools) {
        super(name, "Photometry", DataKind.LIGHT_CURVE, tools);
    }

    @Override
    public ParameterSchema schema() {
        return SCHEMA;
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        StageParameters p = ctx.parameters().orElseGet(() -> SCHEMA.validate(name(), null));
        Path sub = RotseDirs.sub(ctx);
        Path images = OutputLayout.images(sub);
        Path lightCurve = sub.resolve(LIGHT_CURVE_FILE);
        Path nophot = sub.resolve(RotseDirs.NOPHOT);
        Files.createDirectories(nophot);

        for (Path image : Artifact.list(images, ImageDifferencing.DIFFERENCE_GLOB)) {
            String night = image.getFileName().toString().substring(0, 6);
            runPhot(sub, OutputLayout.IMAGE + "/" + night + "*sub*");
            if (Files.exists(lightCurve)) {
                Files.delete(lightCurve);
            } else {
                log.warn("stage={} photometry failed on {}, setting it aside", name(), image.getFileName());
                Files.move(image, nophot.resolve(image.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        if (Artifact.list(nophot, "*").isEmpty()) Files.delete(nophot);

        runPhot(sub, OutputLayout.IMAGE + "/*sub*");
        int nights = Artifact.list(images, ImageDifferencing.DIFFERENCE_GLOB).size();
        log.info("Ran photometry on {} nights of data", nights);
        ctx.scope().note(name(), "ran photometry on " + nights + " nights of data");

        if (!Files.isRegularFile(lightCurve)) {
            throw ExternalToolException.missingOutputs(name(), lightCurve.toString(), Artifact.list(sub, "*"));
        }
        LightCurve curve = LightCurve.parse(lightCurve);
        Path dump = p.path("DUMP_FILE");
        if (!dump.isAbsolute()) dump = ctx.outputDir().resolve(dump);
        curve.writeJson(dump);

        Artifact out = Artifact.of(DataKind.LIGHT_CURVE, List.of(dump, lightCurve))
            .withAttribute("nights", Integer.toString(nights))
            .withAttribute("points", Integer.toString(curve.size()));
        return input.attribute(ChooseRefstars.TEMPLATE)
            .map(t -> out.withAttribute(ChooseRefstars.TEMPLATE, t))
            .orElse(out);
    }

    private void runPhot(Path sub, String pattern) {
        tools().run(name(), ToolCommands.IDL, sub, Idl.call("run_phot", Idl.fileSearch(pattern)));
    }
}
