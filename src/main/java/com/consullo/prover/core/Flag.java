package com.consullo.prover.core;

/**
 * Processing status of a state.
 *
 * @since 1.0
 */
public enum Flag {
  NONE,
  SENT,
  AXIOM,
  VERIFIED,
  ERROR
}
