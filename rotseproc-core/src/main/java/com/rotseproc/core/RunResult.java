package com.rotseproc.core;

import com.rotseproc.core.exception.PipelineAbortedException;
import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @param artifact      main artifact after the last stage that ran
 * @param reports       monitoring reports in stage order
 * @param failure       the stage failure that aborted the run, or null
 * @param stageTimings  one entry per stage that started
 */
public record RunResult(
    String program,
    Artifact artifact,
    List<Report> reports,
    StageError failure,
    List<StageTiming> stageTimings,
    long totalNanos
) {
  public RunResult {
    program = Objects.requireNonNull(program, "program");
    artifact = Objects.requireNonNull(artifact, "artifact");
    reports = List.copyOf(Objects.requireNonNull(reports, "reports"));
    stageTimings = List.copyOf(Objects.requireNonNull(stageTimings, "stageTimings"));
  }

  public boolean aborted() {
    return failure != null;
  }

  public Optional<StageError> error() {
    return Optional.ofNullable(failure);
  }

  /** Worst status over every report; the run's operator-facing health signal. */
  public Severity worstSeverity() {
    List<Severity> all = new ArrayList<>(reports.size());
    for (Report r : reports) all.add(r.status());
    return Severity.worstOf(all);
  }

  public RunResult requireSuccess() {
    if (failure != null) throw new PipelineAbortedException(program, failure);
    return this;
  }
}
