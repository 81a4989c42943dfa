package com.consullo.prover.protocol;

import com.consullo.prover.core.StateId;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Appends one sentence after a given state.
 *
 * @param command sentence text
 * @param editId client-chosen correlation id (negative, never reused)
 * @param stateId state the sentence is added after
 * @param verbose whether the prover should echo informational output
 * @since 1.0
 */
public record AddCall(String command, int editId, StateId stateId, boolean verbose)
    implements ProverCall<AddResult> {

  public AddCall {
    Validate.notNull(command, "command must not be null");
    Validate.notNull(stateId, "stateId must not be null");
  }

  @Override
  public String name() {
    return "Add";
  }

  @Override
  public Object argument() {
    return Pair.of(Pair.of(command, editId), Pair.of(stateId, verbose));
  }

  @Override
  public AddResult interpret(final Object payload) {
    final Pair<?, ?> outer = Payloads.as(payload, Pair.class, "Add");
    final StateId newStateId = Payloads.as(outer.getLeft(), StateId.class, "Add state id");
    final Pair<?, ?> inner = Payloads.as(outer.getRight(), Pair.class, "Add tail");
    final Union closed = Payloads.as(inner.getLeft(), Union.class, "Add closed proof");
    final String message = Payloads.as(inner.getRight(), String.class, "Add message");
    final StateId next = closed.isLeft() ? null : Payloads.as(closed.value(), StateId.class, "Add next state");
    return new AddResult(newStateId, next, message);
  }
}
