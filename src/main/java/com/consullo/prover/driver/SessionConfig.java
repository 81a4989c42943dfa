package com.consullo.prover.driver;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Tuning of one document session.
 *
 * @param dispatcherCapacity maximum number of queued prover exchanges
 * @param feedbackPollInterval how long the dispatcher stays idle before draining prover feedback
 * @param closeTimeout how long close waits for a running exchange before interrupting it
 * @since 1.0
 */
public record SessionConfig(int dispatcherCapacity, Duration feedbackPollInterval, Duration closeTimeout) {

  public static final SessionConfig DEFAULT =
      new SessionConfig(100, Duration.ofMillis(100), Duration.ofSeconds(5));

  public SessionConfig {
    Validate.isTrue(dispatcherCapacity > 0, "dispatcherCapacity must be positive");
    Validate.notNull(feedbackPollInterval, "feedbackPollInterval must not be null");
    Validate.isTrue(!feedbackPollInterval.isNegative() && !feedbackPollInterval.isZero(),
        "feedbackPollInterval must be positive");
    Validate.notNull(closeTimeout, "closeTimeout must not be null");
    Validate.isTrue(!closeTimeout.isNegative(), "closeTimeout must not be negative");
  }
}
