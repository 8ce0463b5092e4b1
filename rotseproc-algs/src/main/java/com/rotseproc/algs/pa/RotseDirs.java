package com.rotseproc.algs.pa;

import com.rotseproc.core.StageContext;

import java.nio.file.Path;

/** Stage directories under the run's output directory. */
final class RotseDirs {
    static final String PREPROC = "preproc";
    static final String COADD = "coadd";
    static final String SUB = "sub";
    static final String NOPHOT = "nophot";

    private RotseDirs() {}

    static Path preproc(StageContext ctx) {
        return ctx.outputDir().resolve(PREPROC);
    }

    static Path coadd(StageContext ctx) {
        return ctx.outputDir().resolve(COADD);
    }

    static Path sub(StageContext ctx) {
        return ctx.outputDir().resolve(SUB);
    }
}
