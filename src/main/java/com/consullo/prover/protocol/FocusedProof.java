package com.consullo.prover.protocol;

import com.consullo.prover.core.StateId;

/**
 * A proof the prover reopened in place instead of discarding everything after the edit point.
 *
 * @param proofStateId state that starts the proof
 * @param qedStateId state that closed the proof
 * @param oldFocusedStateId state that was focused before the edit
 * @since 1.0
 */
public record FocusedProof(StateId proofStateId, StateId qedStateId, StateId oldFocusedStateId) {
}
