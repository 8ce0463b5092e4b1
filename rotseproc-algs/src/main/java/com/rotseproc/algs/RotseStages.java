package com.rotseproc.algs;

import com.rotseproc.algs.io.DataLocator;
import com.rotseproc.algs.pa.ChooseRefstars;
import com.rotseproc.algs.pa.Coaddition;
import com.rotseproc.algs.pa.FindData;
import com.rotseproc.algs.pa.ImageDifferencing;
import com.rotseproc.algs.pa.MakeSubimages;
import com.rotseproc.algs.pa.Photometry;
import com.rotseproc.algs.pa.SourceExtraction;
import com.rotseproc.algs.qa.CountPixels;
import com.rotseproc.core.MetricFigureRenderer;
import com.rotseproc.core.ReportSink;
import com.rotseproc.core.StageRegistry;
import com.rotseproc.external.Toolchain;

/** Registry keys for the ROTSE-III stages. */
public final class RotseStages {
    public static final String FIND_DATA = "find-data";
    public static final String COADDITION = "coaddition";
    public static final String SOURCE_EXTRACTION = "source-extraction";
    public static final String MAKE_SUBIMAGES = "make-subimages";
    public static final String IMAGE_DIFFERENCING = "image-differencing";
    public static final String CHOOSE_REFSTARS = "choose-refstars";
    public static final String PHOTOMETRY = "photometry";
    public static final String COUNT_PIXELS = "count-pixels";

    private RotseStages() {}

    public static StageRegistry registry(Toolchain tools, DataLocator locator, ReportSink sink, MetricFigureRenderer renderer) {
        return new StageRegistry()
            .register(FIND_DATA, name -> new FindData(name, locator))
            .register(COADDITION, name -> new Coaddition(name, tools))
            .register(SOURCE_EXTRACTION, name -> new SourceExtraction(name, tools))
            .register(MAKE_SUBIMAGES, name -> new MakeSubimages(name, tools))
            .register(IMAGE_DIFFERENCING, name -> new ImageDifferencing(name, tools))
            .register(CHOOSE_REFSTARS, name -> new ChooseRefstars(name, tools))
            .register(PHOTOMETRY, name -> new Photometry(name, tools))
            .register(COUNT_PIXELS, name -> new CountPixels(name, sink, renderer));
    }
}
