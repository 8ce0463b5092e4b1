package com.rotseproc.config;

import com.rotseproc.core.DataKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** The parsed configuration document, before any stage is instantiated. */
public record PipelineDefinition(
    String program,
    Path outputDir,
    DataKind seedKind,
    Map<String, Double> referenceMetrics,
    Map<String, List<String>> tools,
    Duration toolTimeout,
    List<StageDefinition> stages
) {
  public PipelineDefinition {
    program = Objects.requireNonNull(program, "program");
    outputDir = Objects.requireNonNull(outputDir, "outputDir");
    seedKind = Objects.requireNonNull(seedKind, "seedKind");
    referenceMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(referenceMetrics, "referenceMetrics")));
    tools = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(tools, "tools")));
    stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
  }

  /** Same document with {@code overrides} taking precedence over the configured reference metrics. */
  public PipelineDefinition withReferenceMetrics(Map<String, Double> overrides) {
    Map<String, Double> merged = new LinkedHashMap<>(referenceMetrics);
    merged.putAll(overrides);
    return new PipelineDefinition(program, outputDir, seedKind, merged, tools, toolTimeout, stages);
  }
}
