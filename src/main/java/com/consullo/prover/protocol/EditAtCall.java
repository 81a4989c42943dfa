package com.consullo.prover.protocol;

import com.consullo.prover.core.StateId;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Rewinds the document to a state.
 *
 * @param stateId target state
 * @since 1.0
 */
public record EditAtCall(StateId stateId) implements ProverCall<EditAtResult> {

  public EditAtCall {
    Validate.notNull(stateId, "stateId must not be null");
  }

  @Override
  public String name() {
    return "Edit_at";
  }

  @Override
  public Object argument() {
    return stateId;
  }

  @Override
  public EditAtResult interpret(final Object payload) {
    final Union union = Payloads.as(payload, Union.class, "Edit_at");
    if (union.isLeft()) {
      return EditAtResult.NO_FOCUS_CHANGE;
    }
    final Pair<?, ?> outer = Payloads.as(union.value(), Pair.class, "Edit_at focus");
    final Pair<?, ?> inner = Payloads.as(outer.getRight(), Pair.class, "Edit_at focus tail");
    return new EditAtResult(new FocusedProof(
        Payloads.as(outer.getLeft(), StateId.class, "Edit_at proof state"),
        Payloads.as(inner.getLeft(), StateId.class, "Edit_at qed state"),
        Payloads.as(inner.getRight(), StateId.class, "Edit_at old focused state")));
  }
}
