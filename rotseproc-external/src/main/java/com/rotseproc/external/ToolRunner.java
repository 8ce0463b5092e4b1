package com.rotseproc.external;

import java.io.IOException;

/** Starts a tool and blocks until it exits. */
@FunctionalInterface
public interface ToolRunner {
    /**
     * @return the tool's exit code
     * @throws IOException if the tool cannot be started or does not finish within its timeout
     */
    int run(ToolInvocation invocation) throws IOException, InterruptedException;
}
