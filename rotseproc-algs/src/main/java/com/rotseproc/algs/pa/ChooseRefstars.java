package com.rotseproc.algs.pa;

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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the template subimage with {@link TemplateSelector} and opens IDL {@code rphot} on it
 * to choose the photometric reference stars. The template's file name is passed on as the
 * {@code template} attribute.
 */
public final class ChooseRefstars extends ToolStage {
    private static final Logger log = LoggerFactory.getLogger(ChooseRefstars.class);

    public static final String TEMPLATE = "template";

    /** Subimage names begin with the {@code yymmdd} night. */
    private static final Pattern DATED = Pattern.compile("\\d{6}.*");

    private static final ParameterSchema SCHEMA = ParameterSchema.builder()
        .required("RA", ParameterType.NUMBER)
        .required("DEC", ParameterType.NUMBER)
        .build();

    public ChooseRefstars(String name, Toolchain tools) {
        super(name, "Choose_Refstars", tools);
    }

    @Override
    public ParameterSchema schema() {
        return SCHEMA;
    }

    @Override
    protected Artifact process(Artifact input, StageContext ctx) throws IOException {
        StageParameters p = requireParameters(ctx);
        Path sub = RotseDirs.sub(ctx);
        Path images = OutputLayout.images(sub);

        // difference images share the directory but are never templates
        List<String> candidates = new ArrayList<>();
        for (Path f : Artifact.list(images, "*")) {
            String n = f.getFileName().toString();
            if (n.contains("sub")) continue;
            if (DATED.matcher(n).matches()) {
                candidates.add(n);
            } else {
                log.warn("stage={} ignoring {}: name does not start with a night", name(), n);
            }
        }
        if (candidates.isEmpty()) {
            throw ExternalToolException.missingOutputs(name(), images.resolve("*_c.fit").toString(), Artifact.list(images, "*"));
        }
        String template = TemplateSelector.select(candidates);
        log.info("stage={} template={} of {} subimages", name(), template, candidates.size());

        String ref = Idl.fileSearch(OutputLayout.IMAGE + "/" + template);
        tools().run(name(), ToolCommands.IDL, sub, Idl.call("rphot", "data",
            "imlist=" + ref,
            "refname=" + ref,
            Idl.keyword("targetra", p.number("RA")),
            Idl.keyword("targetdec", p.number("DEC")),
            "/small"));
        return input.withAttribute(TEMPLATE, template);
    }
}
