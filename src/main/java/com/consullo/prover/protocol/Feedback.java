package com.consullo.prover.protocol;

import com.consullo.prover.core.StateId;
import org.apache.commons.lang3.Validate;

/**
 * An asynchronous notification from the prover.
 *
 * @param stateId state the notification refers to, {@link StateId#NONE} if none
 * @param content typed payload
 * @since 1.0
 */
public record Feedback(StateId stateId, FeedbackContent content) {

  public Feedback {
    Validate.notNull(stateId, "stateId must not be null");
    Validate.notNull(content, "content must not be null");
  }

  public FeedbackContent.Kind kind() {
    return content.kind();
  }
}
