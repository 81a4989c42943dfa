package com.consullo.prover.process;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Configuration for spawning a prover subprocess.
 *
 * @param command command and arguments (e.g., ["coqtop", "-ideslave", ...])
 * @param workingDirectory working directory for the spawned process
 * @param environment environment variables to add/override (may be null)
 * @param charset encoding of both pipes
 * @param shutdownTimeout how long to wait for a graceful exit before killing, and again after killing
 * @since 1.0
 */
public record ProverProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    Charset charset,
    Duration shutdownTimeout) {

  public ProverProcessConfig {
    Validate.notNull(command, "command must not be null");
    Validate.isTrue(!command.isEmpty(), "command must not be empty");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.notNull(charset, "charset must not be null");
    Validate.notNull(shutdownTimeout, "shutdownTimeout must not be null");
    Validate.isTrue(!shutdownTimeout.isNegative(), "shutdownTimeout must not be negative");
    command = List.copyOf(command);
  }
}
