package com.rotseproc.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rotseproc.core.DataKind;
import com.rotseproc.core.Orchestrator;
import com.rotseproc.core.Stage;
import com.rotseproc.core.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the JSON pipeline document.
 *
 * <p>Structural problems (malformed JSON, a missing or unknown key, an unsupported stage) raise
 * {@link IOException}. Parameter blocks are kept raw here; their validation against each
 * stage's schema happens in {@link Orchestrator.Builder#build()}.
 */
public final class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);
    private static final ObjectMapper M = new ObjectMapper();

    private static final Set<String> TOP_LEVEL = Set.of("program", "outputDir", "seedKind", "referenceMetrics", "tools", "stages");
    private static final Set<String> STAGE_KEYS = Set.of("name", "stage", "params", "qaFile", "qaFigure");
    private static final String TIMEOUT_KEY = "timeoutMinutes";

    private PipelineConfigLoader() {}

    public static PipelineDefinition load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static PipelineDefinition load(InputStream in) throws IOException {
        JsonNode root = M.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("Configuration must be a JSON object");
        rejectUnknown(root, TOP_LEVEL, "configuration");

        String program = text(req(root, "program"), "program");
        Path outputDir = Path.of(text(req(root, "outputDir"), "outputDir"));
        DataKind seedKind = root.has("seedKind") ? DataKind.of(text(root.get("seedKind"), "seedKind")) : DataKind.IMAGE_COLLECTION;

        Map<String, Double> refs = new LinkedHashMap<>();
        JsonNode refNode = root.path("referenceMetrics");
        if (!refNode.isMissingNode()) {
            if (!refNode.isObject()) throw new IOException("referenceMetrics must be an object");
            for (Iterator<Map.Entry<String, JsonNode>> it = refNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isNumber()) throw new IOException("Reference metric '" + e.getKey() + "' must be a number");
                refs.put(e.getKey(), e.getValue().asDouble());
            }
        }

        Map<String, List<String>> tools = new LinkedHashMap<>();
        Duration timeout = null;
        JsonNode toolsNode = root.path("tools");
        if (!toolsNode.isMissingNode()) {
            if (!toolsNode.isObject()) throw new IOException("tools must be an object");
            for (Iterator<Map.Entry<String, JsonNode>> it = toolsNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                if (TIMEOUT_KEY.equals(e.getKey())) {
                    if (!e.getValue().canConvertToLong() || e.getValue().asLong() <= 0) {
                        throw new IOException("tools.timeoutMinutes must be a positive integer");
                    }
                    timeout = Duration.ofMinutes(e.getValue().asLong());
                } else {
                    tools.put(e.getKey(), command(e.getKey(), e.getValue()));
                }
            }
        }

        JsonNode arr = req(root, "stages");
        if (!arr.isArray()) throw new IOException("stages must be an array");
        List<StageDefinition> stages = new ArrayList<>();
        for (JsonNode s : arr) stages.add(stage(s));

        log.debug("loaded program={} stages={} tools={}", program, stages.size(), tools.keySet());
        return new PipelineDefinition(program, outputDir, seedKind, refs, tools, timeout, stages);
    }

    /**
     * An orchestrator builder with every configured stage added, resolved through
     * {@code registry} or, for a fully qualified class name, by reflection. The caller
     * attaches an observer or recorder and calls {@code build()}.
     */
    public static Orchestrator.Builder builder(PipelineDefinition def, StageRegistry registry) throws IOException {
        Orchestrator.Builder b = Orchestrator.builder(def.program(), def.outputDir())
            .seedKind(def.seedKind())
            .referenceMetrics(def.referenceMetrics());
        for (StageDefinition sd : def.stages()) {
            Stage<?> stage = registry.has(sd.stage()) ? registry.create(sd.stage(), sd.name()) : instantiate(sd.stage(), sd.name());
            b.addStage(new Orchestrator.StageEntry(stage, sd.params(), sd.qaFile(), sd.qaFigure()));
        }
        return b;
    }

    private static StageDefinition stage(JsonNode s) throws IOException {
        if (!s.isObject()) throw new IOException("Unsupported stage entry: " + s);
        rejectUnknown(s, STAGE_KEYS, "stage entry");
        String key = text(req(s, "stage"), "stage");
        String name = s.has("name") ? text(s.get("name"), "name") : null;

        Map<String, Object> params = null;
        if (s.has("params")) {
            JsonNode p = s.get("params");
            if (!p.isObject()) throw new IOException("params of stage '" + key + "' must be an object");
            params = M.convertValue(p, new TypeReference<LinkedHashMap<String, Object>>() {});
        }
        Path qaFile = s.has("qaFile") ? Path.of(text(s.get("qaFile"), "qaFile")) : null;
        Path qaFigure = s.has("qaFigure") ? Path.of(text(s.get("qaFigure"), "qaFigure")) : null;
        return new StageDefinition(name, key, params, qaFile, qaFigure);
    }

    private static Stage<?> instantiate(String fqcn, String name) throws IOException {
        if (!fqcn.contains(".")) throw new IOException("Unsupported stage: " + fqcn);
        try {
            Class<?> c = Class.forName(fqcn);
            Object o;
            try {
                Constructor<?> named = c.getDeclaredConstructor(String.class);
                named.setAccessible(true);
                o = named.newInstance(name);
            } catch (NoSuchMethodException e) {
                Constructor<?> ctor = c.getDeclaredConstructor();
                ctor.setAccessible(true);
                o = ctor.newInstance();
            }
            if (o instanceof Stage<?> stage) return stage;
            throw new IOException("Class does not implement Stage: " + fqcn);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to instantiate " + fqcn, e);
        }
    }

    private static List<String> command(String tool, JsonNode node) throws IOException {
        if (!node.isArray() || node.isEmpty()) throw new IOException("Tool '" + tool + "' must be a non-empty array of strings");
        List<String> out = new ArrayList<>();
        for (JsonNode part : node) out.add(text(part, "tools." + tool));
        return out;
    }

    private static void rejectUnknown(JsonNode n, Set<String> allowed, String where) throws IOException {
        for (Iterator<String> it = n.fieldNames(); it.hasNext(); ) {
            String f = it.next();
            if (!allowed.contains(f)) throw new IOException("Unknown " + where + " field: " + f);
        }
    }

    private static String text(JsonNode n, String field) throws IOException {
        if (!n.isTextual() || n.asText().isBlank()) throw new IOException("Field must be a non-empty string: " + field);
        return n.asText();
    }

    private static JsonNode req(JsonNode n, String field) throws IOException {
        if (!n.has(field)) throw new IOException("Missing required field: " + field);
        return n.get(field);
    }
}
