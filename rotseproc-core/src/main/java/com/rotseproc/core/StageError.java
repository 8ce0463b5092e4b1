package com.rotseproc.core;

import java.util.Objects;

public record StageError(
    String program,
    int stageIndex,
    String stageName,
    Exception exception
) {
  public StageError {
    program = Objects.requireNonNull(program, "program");
    if (stageIndex < 0) throw new IllegalArgumentException("stageIndex must be >= 0");
    stageName = Objects.requireNonNull(stageName, "stageName");
    exception = Objects.requireNonNull(exception, "exception");
  }
}
