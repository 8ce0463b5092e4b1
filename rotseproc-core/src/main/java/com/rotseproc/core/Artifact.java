package com.rotseproc.core;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The value handed from one stage to the next: a kind tag plus the files it consists of, in
 * order, and a few named attributes a stage discovered along the way.
 */
public record Artifact(DataKind kind, List<Path> files, Map<String, String> attributes) {
  public Artifact {
    kind = Objects.requireNonNull(kind, "kind");
    files = List.copyOf(Objects.requireNonNull(files, "files"));
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(attributes, "attributes")));
  }

  public static Artifact of(DataKind kind, List<Path> files) {
    return new Artifact(kind, files, Map.of());
  }

  public static Artifact empty(DataKind kind) {
    return new Artifact(kind, List.of(), Map.of());
  }

  /** Regular files in {@code dir} matching {@code glob}, sorted by name; a missing directory yields none. */
  public static Artifact discover(DataKind kind, Path dir, String glob) throws IOException {
    return of(kind, list(dir, glob));
  }

  public static List<Path> list(Path dir, String glob) throws IOException {
    if (!Files.isDirectory(dir)) return List.of();
    List<Path> out = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
      for (Path p : stream) {
        if (Files.isRegularFile(p)) out.add(p);
      }
    }
    out.sort(Path::compareTo);
    return out;
  }

  public Artifact withAttribute(String key, String value) {
    Map<String, String> copy = new LinkedHashMap<>(attributes);
    copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new Artifact(kind, files, copy);
  }

  public Optional<String> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }
}
