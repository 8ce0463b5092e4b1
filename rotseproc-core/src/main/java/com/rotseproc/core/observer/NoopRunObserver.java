package com.rotseproc.core.observer;

import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;

public final class NoopRunObserver implements RunObserver {
  public static final NoopRunObserver INSTANCE = new NoopRunObserver();
  private static final RunScope NOOP_SCOPE = new RunScope() {
    public void onStageStart(int index, String stageName) {}
    public void onStageEnd(int index, String stageName, long elapsedNanos, boolean success) {}
    public void onStageError(int index, String stageName, Throwable error) {}
    public void onReport(int index, Report report) {}
    public void onRunEnd(boolean success, Severity worst, long elapsedNanos, Throwable error) {}
    public void note(String stageName, String message) {}
  };
  private NoopRunObserver() {}
  @Override public RunScope onRunStart(String program, String runId, int stageCount) { return NOOP_SCOPE; }
}
