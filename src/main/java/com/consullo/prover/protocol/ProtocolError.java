package com.consullo.prover.protocol;

import com.consullo.prover.core.Location;
import com.consullo.prover.core.StateId;

/**
 * A {@code fail} answer from the prover.
 *
 * @param location offending range inside the sentence, or {@code null} if the prover gave none
 * @param stateId state the prover considers valid after the failure (the suggested rewind point for Edit_at)
 * @param message rendered error text
 * @since 1.0
 */
public record ProtocolError(Location location, StateId stateId, String message) {
}
