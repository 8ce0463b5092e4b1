package com.rotseproc.algs.pa;

import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.StageContext;
import com.rotseproc.external.OutputLayout;
import com.rotseproc.external.ToolCommands;
import com.rotseproc.external.Toolchain;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Subtracts the template from every subimage; difference images appear in {@code sub/image} as {@code *sub*}. */
public final class ImageDifferencing extends ToolStage {
    static final String DIFFERENCE_GLOB = "*sub*";

    public ImageDifferencing(String name, Toolchain tools) {
        super(name, "Image_Differencing", tools);
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        Path sub = RotseDirs.sub(ctx);
        Path images = OutputLayout.images(sub);
        tools().run(name(), ToolCommands.DIFFERENCE, sub, "-i", images.toAbsolutePath().toString());
        List<Path> differences = OutputLayout.requireOutputs(name(), images, DIFFERENCE_GLOB);
        return new Artifact(DataKind.IMAGE_COLLECTION, differences, input.attributes());
    }
}
