package com.consullo.prover.display;

/**
 * Token for a decoration currently shown by a {@link DisplaySink}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface HighlightHandle {

  /** Removes the decoration. Calling it again has no effect. */
  void remove();
}
