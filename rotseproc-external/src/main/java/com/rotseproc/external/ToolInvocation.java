package com.rotseproc.external;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One blocking run of an external executable.
 *
 * @param command     executable followed by its arguments
 * @param workingDir  directory the tool runs in; tools write their outputs relative to it
 * @param timeout     upper bound on the wait, or null to wait indefinitely
 * @param environment extra environment variables
 * @param logFile     file receiving the tool's combined stdout/stderr, or null to inherit the console
 */
public record ToolInvocation(
    List<String> command,
    Path workingDir,
    Duration timeout,
    Map<String, String> environment,
    Path logFile
) {
  public ToolInvocation {
    command = List.copyOf(Objects.requireNonNull(command, "command"));
    if (command.isEmpty()) throw new IllegalArgumentException("command must not be empty");
    workingDir = Objects.requireNonNull(workingDir, "workingDir");
    environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment == null ? Map.of() : environment));
  }

  public static ToolInvocation of(List<String> command, Path workingDir) {
    return new ToolInvocation(command, workingDir, null, Map.of(), null);
  }

  public String commandLine() {
    return String.join(" ", command);
  }
}
