package com.consullo.prover.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prover controller implemented with {@link ProcessBuilder}.
 *
 * <p>stdin and stdout are piped to the caller; stderr is inherited so prover diagnostics reach the
 * console of the hosting editor.
 *
 * @since 1.0
 */
public final class ProverProcessControllerJdk implements ProverProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProverProcessControllerJdk.class);

  private final Process process;

  /**
   * Spawns the prover process.
   *
   * @param config process configuration (command, working directory, environment)
   * @throws Exception if process cannot be started
   */
  public ProverProcessControllerJdk(final ProverProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");

    final ProcessBuilder builder = new ProcessBuilder(config.command());
    builder.directory(config.workingDirectory().toFile());
    builder.redirectError(ProcessBuilder.Redirect.INHERIT);
    final Map<String, String> env = builder.environment();
    if (config.environment() != null) {
      env.putAll(config.environment());
    }

    this.process = builder.start();
    LOGGER.debug("Spawned {} with PID={}", config.command(), this.process.pid());
  }

  @Override
  public InputStream getProcessOutput() {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream getProcessInput() {
    return this.process.getOutputStream();
  }

  @Override
  public boolean waitFor(final Duration timeout) throws InterruptedException {
    return this.process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void destroyForcibly() {
    LOGGER.debug("Killing prover PID={}", this.process.pid());
    this.process.destroyForcibly();
  }

  @Override
  public void close() {
    LOGGER.debug("Terminating prover PID={}", this.process.pid());
    this.process.destroy();
  }
}
