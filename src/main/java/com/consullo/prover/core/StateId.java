package com.consullo.prover.core;

/**
 * Opaque identifier the prover assigns to each accepted sentence.
 *
 * <p>Identifiers carry no ordering; only equality is meaningful.
 *
 * @param value raw identifier as it appears on the wire
 * @since 1.0
 */
public record StateId(int value) {

  /** Placeholder for feedback that is not attached to a tracked state. */
  public static final StateId NONE = new StateId(0);

  public static StateId of(final int value) {
    return new StateId(value);
  }

  public boolean isNone() {
    return value == 0;
  }

  @Override
  public String toString() {
    return "StateId(" + value + ")";
  }
}
