package com.consullo.prover.protocol;

/**
 * Answer to {@link EditAtCall}.
 *
 * @param focusedProof the reopened proof, or {@code null} when the whole tail after the target was dropped
 * @since 1.0
 */
public record EditAtResult(FocusedProof focusedProof) {

  public static final EditAtResult NO_FOCUS_CHANGE = new EditAtResult(null);

  public boolean focusChanged() {
    return focusedProof != null;
  }
}
