package com.rotseproc.algs.pa;

import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.StageContext;
import com.rotseproc.core.params.ParameterSchema;
import com.rotseproc.core.params.ParameterType;
import com.rotseproc.core.params.StageParameters;
import com.rotseproc.external.OutputLayout;
import com.rotseproc.external.ToolCommands;
import com.rotseproc.external.Toolchain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Cuts subimages centred on the target out of every coadd, and out of the telescope's
 * template images for the supernova program, with IDL {@code make_rotse3_subimage}.
 * Subimages go to {@code sub/image}, their catalogs to {@code sub/prod}.
 */
public final class MakeSubimages extends ToolStage {
    private static final Logger log = LoggerFactory.getLogger(MakeSubimages.class);

    private static final ParameterSchema SCHEMA = ParameterSchema.builder()
        .required("RA", ParameterType.NUMBER)
        .required("DEC", ParameterType.NUMBER)
        .required("PIXEL_RADIUS", ParameterType.NUMBER)
        .optional("TEMPLATE_DIR", ParameterType.PATH)
        .optional("TELESCOPE", ParameterType.TEXT)
        .build();

    public MakeSubimages(String name, Toolchain tools) {
        super(name, "Make_Subimages", tools);
    }

    @Override
    public ParameterSchema schema() {
        return SCHEMA;
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        StageParameters p = requireParameters(ctx);
        Path coadd = RotseDirs.coadd(ctx);

        TreeSet<String> images = new TreeSet<>();
        for (Path f : input.files()) images.add(f.toAbsolutePath().toString());
        Optional<Path> templateDir = p.optionalPath("TEMPLATE_DIR");
        if (FindData.PROGRAM.equals(ctx.program()) && templateDir.isPresent()) {
            List<Path> templates = copyTemplates(templateDir.get(), p.optionalText("TELESCOPE").orElse(null), coadd);
            if (templates.isEmpty()) ctx.scope().note(name(), "no template images in " + templateDir.get());
            for (Path t : templates) images.add(t.toAbsolutePath().toString());
        }

        tools().run(name(), ToolCommands.IDL, coadd, Idl.call("make_rotse3_subimage",
            Idl.array(new ArrayList<>(images)),
            Idl.keyword("racent", p.number("RA")),
            Idl.keyword("deccent", p.number("DEC")),
            Idl.keyword("pixrad", p.number("PIXEL_RADIUS"))));

        Path sub = OutputLayout.create(RotseDirs.sub(ctx));
        OutputLayout.moveMatching(coadd, "*_c.fit", OutputLayout.images(sub));
        OutputLayout.moveMatching(coadd, "*_cobj.fit", OutputLayout.prods(sub));
        List<Path> subimages = OutputLayout.requireOutputs(name(), OutputLayout.images(sub), "*_c.fit");
        log.debug("stage={} made {} subimages from {} images", name(), subimages.size(), images.size());
        return new Artifact(DataKind.IMAGE_COLLECTION, subimages, input.attributes());
    }

    /** Copies template images into {@code coadd/image} and template catalogs into {@code coadd/prod}. */
    static List<Path> copyTemplates(Path templateDir, String telescope, Path coadd) throws IOException {
        List<Path> images = OutputLayout.copyAll(forTelescope(Artifact.list(templateDir, "*_c.fit"), telescope), OutputLayout.images(coadd));
        OutputLayout.copyAll(forTelescope(Artifact.list(templateDir, "*_cobj.fit"), telescope), OutputLayout.prods(coadd));
        return images;
    }

    private static List<Path> forTelescope(List<Path> files, String telescope) {
        if (telescope == null) return files;
        List<Path> out = new ArrayList<>();
        for (Path f : files) {
            if (f.getFileName().toString().contains("_" + telescope + "_")) out.add(f);
        }
        return out;
    }
}
