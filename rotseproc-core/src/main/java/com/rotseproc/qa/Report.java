package com.rotseproc.qa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one monitoring stage invocation.
 *
 * @param program    program the run belongs to
 * @param stageName  monitoring stage name
 * @param parameters configuration used, as configured
 * @param status     worst severity over every graded metric
 * @param metrics    metric name to its textual value; vectors render as {@code [a, b, ...]}
 * @param checks     per graded metric severity
 */
public record Report(
    String program,
    String stageName,
    Map<String, Object> parameters,
    Severity status,
    Map<String, String> metrics,
    Map<String, Severity> checks
) {
  public Report {
    program = Objects.requireNonNull(program, "program");
    stageName = Objects.requireNonNull(stageName, "stageName");
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters")));
    status = Objects.requireNonNull(status, "status");
    metrics = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(metrics, "metrics")));
    checks = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(checks, "checks")));
  }
}
