package com.consullo.prover.stm;

import com.consullo.prover.protocol.Feedback;

/**
 * One link of a feedback handler chain.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface FeedbackHandler {

  /** Handler that consumes nothing. */
  FeedbackHandler NONE = feedback -> false;

  /**
   * Offers a feedback to this handler.
   *
   * @param feedback inbound feedback
   * @return true if consumed; the chain stops there
   */
  boolean handle(Feedback feedback);
}
