package com.consullo.prover.stm;

import com.consullo.prover.protocol.Feedback;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offers each feedback to a chain of handlers in order until one consumes it.
 *
 * <p>The state machine's handler comes first so flag updates happen even when a later handler also
 * observes the raw feedback stream. Feedback nobody consumes is dropped.
 *
 * @since 1.0
 */
public final class FeedbackRouter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeedbackRouter.class);

  private final String documentId;
  private final List<FeedbackHandler> chain;

  public FeedbackRouter(final String documentId, final List<FeedbackHandler> chain) {
    Validate.notBlank(documentId, "documentId must not be blank");
    Validate.noNullElements(chain, "chain must not contain null handlers");
    this.documentId = documentId;
    this.chain = List.copyOf(chain);
  }

  /**
   * Routes one feedback.
   *
   * @param feedback inbound feedback
   * @return true if some handler consumed it
   */
  public boolean route(final Feedback feedback) {
    Validate.notNull(feedback, "feedback must not be null");
    for (FeedbackHandler handler : chain) {
      if (handler.handle(feedback)) {
        return true;
      }
    }
    LOGGER.trace("[{}] unhandled feedback {}", documentId, feedback);
    return false;
  }
}
