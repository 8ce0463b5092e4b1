package com.rotseproc.algs.pa;

import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.StageContext;
import com.rotseproc.external.OutputLayout;
import com.rotseproc.external.ToolCommands;
import com.rotseproc.external.Toolchain;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Coadds each night's preprocessed images with IDL {@code coadd_all}; the coadds land in {@code coadd/image}. */
public final class Coaddition extends ToolStage {
    static final String COADD_GLOB = "*000-000_c.fit";

    public Coaddition(String name, Toolchain tools) {
        super(name, "Coaddition", tools);
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        if (input.isEmpty()) throw new IOException("No preprocessed images to coadd");
        Path preproc = RotseDirs.preproc(ctx);

        List<String> files = new ArrayList<>();
        for (Path p : input.files()) files.add(p.toAbsolutePath().toString());
        tools().run(name(), ToolCommands.IDL, preproc, Idl.call("coadd_all", Idl.array(files)));

        Path coadd = OutputLayout.create(RotseDirs.coadd(ctx));
        OutputLayout.moveMatching(preproc, COADD_GLOB, OutputLayout.images(coadd));
        List<Path> coadds = OutputLayout.requireOutputs(name(), OutputLayout.images(coadd), COADD_GLOB);
        return new Artifact(DataKind.IMAGE_COLLECTION, coadds, input.attributes());
    }
}
