package com.rotseproc.core.observer;

import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes run events as key=value lines through SLF4J. The run id sits in the {@code runId} MDC
 * key between {@code run.start} and {@code run.end}; runs are single-threaded so the
 * thread-bound MDC is the run's own.
 */
public final class LoggingRunObserver implements RunObserver {
  public static final String MDC_RUN_ID = "runId";

  private final Logger log;

  public LoggingRunObserver() { this(LoggerFactory.getLogger("com.rotseproc.run")); }
  public LoggingRunObserver(Logger log) { this.log = log; }

  @Override public RunScope onRunStart(String program, String runId, int stageCount) {
    MDC.put(MDC_RUN_ID, runId);
    log.info("run.start program={} runId={} stages={}", program, runId, stageCount);
    return new RunScope() {
      @Override public void onStageStart(int idx, String stageName) {
        log.info("stage.start runId={} idx={} stage={}", runId, idx, stageName);
      }
      @Override public void onStageEnd(int idx, String stageName, long nanos, boolean success) {
        if (log.isInfoEnabled()) log.info(String.format("stage.end runId=%s idx=%d stage=%s durMs=%.3f success=%s",
            runId, idx, stageName, nanos / 1_000_000.0, success));
      }
      @Override public void onStageError(int idx, String stageName, Throwable error) {
        log.error("stage.error runId={} idx={} stage={}", runId, idx, stageName, error);
      }
      @Override public void onReport(int idx, Report report) {
        if (report.status() == Severity.NORMAL) {
          log.info("qa.report runId={} stage={} status={} metrics={}", runId, report.stageName(), report.status(), report.checks());
        } else {
          log.warn("qa.report runId={} stage={} status={} metrics={}", runId, report.stageName(), report.status(), report.checks());
        }
      }
      @Override public void onRunEnd(boolean success, Severity worst, long nanos, Throwable error) {
        try {
          String line = String.format("run.end program=%s runId=%s durMs=%.3f success=%s worst=%s",
              program, runId, nanos / 1_000_000.0, success, worst);
          if (error == null) log.info(line);
          else log.error(line, error);
        } finally {
          MDC.remove(MDC_RUN_ID);
        }
      }
      @Override public void note(String stageName, String message) {
        log.info("stage.note runId={} stage={} {}", runId, stageName, message);
      }
    };
  }
}
