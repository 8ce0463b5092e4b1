package com.rotseproc.algs.qa;

import com.rotseproc.algs.io.FitsImage;
import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.MetricFigureRenderer;
import com.rotseproc.core.MonitoringStage;
import com.rotseproc.core.ReportSink;
import com.rotseproc.core.StageContext;
import com.rotseproc.qa.Metric;
import com.rotseproc.qa.MetricCheck;
import com.rotseproc.qa.RangeClassifier;
import com.rotseproc.qa.ReferenceMode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Mean pixel value of every image ({@code COUNT_PER_IMAGE}), graded by its median
 * ({@code COUNT}) against {@code COUNT_REF}, {@code COUNT_NORMAL_RANGE} and
 * {@code COUNT_WARN_RANGE}.
 */
public final class CountPixels extends MonitoringStage {
    public static final String COUNT = "COUNT";
    public static final String COUNT_PER_IMAGE = "COUNT_PER_IMAGE";

    public CountPixels(String name, ReportSink sink, MetricFigureRenderer renderer) {
        super(name, "Count_Pixels", DataKind.IMAGE_COLLECTION,
            List.of(MetricCheck.conventional(COUNT, ReferenceMode.DIFFERENCE)), sink, renderer);
    }

    @Override
    protected List<Metric> measure(Artifact input, StageContext context) throws IOException {
        List<Double> perImage = new ArrayList<>(input.files().size());
        for (Path image : input.files()) perImage.add(FitsImage.open(image).meanPixel());
        return List.of(
            Metric.scalar(COUNT, RangeClassifier.median(perImage)),
            Metric.vector(COUNT_PER_IMAGE, perImage));
    }
}
