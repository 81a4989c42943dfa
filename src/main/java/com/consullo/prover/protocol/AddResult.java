package com.consullo.prover.protocol;

import com.consullo.prover.core.StateId;

/**
 * Answer to {@link AddCall}.
 *
 * @param stateId id assigned to the new sentence
 * @param closedProofNextStateId when the prover closed an already focused proof, the state to continue
 * from; {@code null} otherwise
 * @param message informational output, possibly empty
 * @since 1.0
 */
public record AddResult(StateId stateId, StateId closedProofNextStateId, String message) {

  public boolean closedProof() {
    return closedProofNextStateId != null;
  }
}
