package com.rotseproc.core;

import java.util.Objects;

public record StageTiming(
    int index,
    String stageName,
    long elapsedNanos,
    boolean success
) {
  public StageTiming {
    stageName = Objects.requireNonNull(stageName, "stageName");
  }
}
