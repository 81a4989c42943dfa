package com.consullo.prover.process;

/**
 * The prover process has quit or its pipes are broken. The condition is permanent.
 *
 * @since 1.0
 */
public class ProverQuitException extends Exception {

  private static final long serialVersionUID = 1L;

  public ProverQuitException(final String message) {
    super(message);
  }

  public ProverQuitException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
