package com.consullo.prover.protocol;

import com.consullo.prover.core.StateId;
import java.util.Optional;

/**
 * Starts a document and returns the root state id.
 *
 * @since 1.0
 */
public record InitCall() implements ProverCall<StateId> {

  @Override
  public String name() {
    return "Init";
  }

  @Override
  public Object argument() {
    return Optional.empty();
  }

  @Override
  public StateId interpret(final Object payload) {
    return Payloads.as(payload, StateId.class, "Init");
  }
}
