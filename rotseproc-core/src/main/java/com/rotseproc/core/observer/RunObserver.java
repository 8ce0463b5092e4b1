package com.rotseproc.core.observer;

import com.rotseproc.qa.Report;
import com.rotseproc.qa.Severity;

/**
 * Run-scoped reporting handle. One scope is opened per orchestrator run and threaded to every
 * stage through its context; nothing about it is process-wide.
 */
public interface RunObserver {
    /** Called at the start of a pipeline run. */
    RunScope onRunStart(String program, String runId, int stageCount);

    /** Stage-level and end-of-run events for one run. */
    interface RunScope {
        void onStageStart(int index, String stageName);
        void onStageEnd(int index, String stageName, long elapsedNanos, boolean success);
        void onStageError(int index, String stageName, Throwable error);
        void onReport(int index, Report report);
        void onRunEnd(boolean success, Severity worst, long elapsedNanos, Throwable error);

        /** Operator-facing progress line from inside a stage. */
        void note(String stageName, String message);
    }
}
