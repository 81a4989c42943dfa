package com.consullo.prover.protocol;

/**
 * The wire {@code unit} value.
 *
 * @since 1.0
 */
public enum Unit {
  INSTANCE
}
