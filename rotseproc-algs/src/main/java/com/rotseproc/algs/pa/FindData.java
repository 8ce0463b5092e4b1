package com.rotseproc.algs.pa;

import com.rotseproc.algs.io.ConventionalDataLocator;
import com.rotseproc.algs.io.DataLocator;
import com.rotseproc.algs.io.Nights;
import com.rotseproc.core.Artifact;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.ProcessingStage;
import com.rotseproc.core.StageContext;
import com.rotseproc.core.exception.ConfigurationException;
import com.rotseproc.core.params.ParameterSchema;
import com.rotseproc.core.params.ParameterType;
import com.rotseproc.core.params.StageParameters;
import com.rotseproc.external.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Finds the preprocessed images of one supernova field around a night and copies each image
 * that has a product catalog, together with that catalog, into {@code preproc/}.
 */
public final class FindData extends ProcessingStage {
    private static final Logger log = LoggerFactory.getLogger(FindData.class);

    public static final String PROGRAM = "supernova";

    private static final ParameterSchema SCHEMA = ParameterSchema.builder()
        .required("NIGHT", ParameterType.TEXT)
        .required("DATA_DIR", ParameterType.PATH)
        .optional("TELESCOPE", ParameterType.TEXT)
        .optional("FIELD", ParameterType.TEXT)
        .optional("RA", ParameterType.NUMBER)
        .optional("DEC", ParameterType.NUMBER)
        .optional("TIME_BEFORE_DISCOVERY", ParameterType.NUMBER, 0)
        .optional("TIME_AFTER_DISCOVERY", ParameterType.NUMBER, 0)
        .optional("FIELD_CENTRES", ParameterType.PATH)
        .build();

    private final DataLocator locator;

    public FindData(String name) {
        this(name, new ConventionalDataLocator());
    }

    public FindData(String name, DataLocator locator) {
        super(name, "Find_Data", DataKind.IMAGE_COLLECTION, DataKind.IMAGE_COLLECTION);
        this.locator = Objects.requireNonNull(locator, "locator");
    }

    @Override
    public ParameterSchema schema() {
        return SCHEMA;
    }

    @Override
    public void validate(StageParameters p) {
        night(p);
        if (p.number("TIME_BEFORE_DISCOVERY") < 0) throw ConfigurationException.invalid(name(), "TIME_BEFORE_DISCOVERY", "must not be negative");
        if (p.number("TIME_AFTER_DISCOVERY") < 0) throw ConfigurationException.invalid(name(), "TIME_AFTER_DISCOVERY", "must not be negative");
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        StageParameters p = requireParameters(ctx);
        if (!PROGRAM.equals(ctx.program())) {
            throw new ConfigurationException(name(), "program", "Program '" + ctx.program() + "' is not valid, can't find data");
        }
        LocalDate night = night(p);
        Path dataDir = p.path("DATA_DIR");
        DataLocator source = p.optionalPath("FIELD_CENTRES")
            .map(this::tableLocator)
            .orElse(locator);
        String field = field(p, source, dataDir);
        String telescope = p.optionalText("TELESCOPE").orElse(null);

        DataLocator.Found found = source.locate(new DataLocator.Query(dataDir, night, telescope, field,
            p.number("TIME_BEFORE_DISCOVERY"), p.number("TIME_AFTER_DISCOVERY")));
        List<Path> images = new ArrayList<>();
        List<Path> prods = new ArrayList<>();
        pairUp(found, images, prods);
        log.info("stage={} field={} night={} images={} (dropped {} without product)",
            name(), field, Nights.format(night), images.size(), found.images().size() - images.size());
        if (images.isEmpty()) ctx.scope().note(name(), "no preprocessed images for field " + field + " around " + Nights.format(night));

        Path preproc = OutputLayout.create(RotseDirs.preproc(ctx));
        List<Path> copied = OutputLayout.copyAll(images, OutputLayout.images(preproc));
        OutputLayout.copyAll(prods, OutputLayout.prods(preproc));

        return Artifact.of(DataKind.IMAGE_COLLECTION, copied)
            .withAttribute("field", field)
            .withAttribute("night", Nights.format(night));
    }

    private DataLocator tableLocator(Path table) {
        try {
            return new ConventionalDataLocator(ConventionalDataLocator.readFieldCentres(table));
        } catch (IOException e) {
            throw ConfigurationException.invalid(name(), "FIELD_CENTRES", e.getMessage());
        }
    }

    private String field(StageParameters p, DataLocator source, Path dataDir) throws IOException {
        var configured = p.optionalText("FIELD");
        if (configured.isPresent()) return configured.get();

        OptionalDouble ra = p.optionalNumber("RA");
        OptionalDouble dec = p.optionalNumber("DEC");
        if (ra.isEmpty() || dec.isEmpty()) {
            throw new ConfigurationException(name(), "FIELD", "Stage '" + name() + "' needs either FIELD or both RA and DEC");
        }
        return source.resolveField(dataDir, ra.getAsDouble(), dec.getAsDouble())
            .orElseThrow(() -> new ConfigurationException(name(), "RA",
                "No supernova field contains data for RA=" + ra.getAsDouble() + ", DEC=" + dec.getAsDouble()));
    }

    private LocalDate night(StageParameters p) {
        try {
            return Nights.parse(p.text("NIGHT"));
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.invalid(name(), "NIGHT", e.getMessage());
        }
    }

    /** Keeps images that have at least one product sharing their root name, and those products. */
    static void pairUp(DataLocator.Found found, List<Path> images, List<Path> prods) {
        List<Path> remaining = new ArrayList<>(found.prods());
        for (Path image : found.images()) {
            String root = root(image.getFileName().toString());
            List<Path> matched = new ArrayList<>();
            for (Path prod : remaining) {
                if (prod.getFileName().toString().startsWith(root + "_")) matched.add(prod);
            }
            if (matched.isEmpty()) continue;
            images.add(image);
            prods.addAll(matched);
            remaining.removeAll(matched);
        }
    }

    static String root(String fileName) {
        int dot = fileName.indexOf('.');
        String base = dot < 0 ? fileName : fileName.substring(0, dot);
        return base.endsWith("_c") ? base.substring(0, base.length() - 2) : base;
    }
}
