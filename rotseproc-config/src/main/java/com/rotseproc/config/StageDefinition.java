package com.rotseproc.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the {@code stages} array.
 *
 * @param name       configured stage name, or null to use the stage's default
 * @param stage      registry key or fully qualified class name
 * @param params     raw parameter block, or null when the entry has none
 * @param qaFile     report path for monitoring stages, or null
 * @param qaFigure   figure path for monitoring stages, or null
 */
public record StageDefinition(String name, String stage, Map<String, Object> params, Path qaFile, Path qaFigure) {
  public StageDefinition {
    stage = Objects.requireNonNull(stage, "stage");
    if (params != null) params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
