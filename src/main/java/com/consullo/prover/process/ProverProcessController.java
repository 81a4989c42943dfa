package com.consullo.prover.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

/**
 * Minimal controller for a prover subprocess attached through its standard pipes.
 *
 * <p>Implementations must provide:
 * - the child's stdout (protocol answers and feedback) and stdin (requests)
 * - waiting for exit
 * - graceful and forced termination
 *
 * @since 1.0
 */
public interface ProverProcessController extends AutoCloseable {

  /**
   * Stream the prover writes to.
   *
   * @return the child's standard output
   * @throws Exception if the stream is unavailable
   */
  InputStream getProcessOutput() throws Exception;

  /**
   * Stream the prover reads requests from.
   *
   * @return the child's standard input
   * @throws Exception if the stream is unavailable
   */
  OutputStream getProcessInput() throws Exception;

  /**
   * Waits for the process to exit.
   *
   * @param timeout maximum wait
   * @return true if the process exited within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  boolean waitFor(final Duration timeout) throws InterruptedException;

  /** Kills the process without waiting. */
  void destroyForcibly();

  /** Asks the process to terminate without waiting. */
  @Override
  void close();
}
