package com.consullo.prover.display;

import com.consullo.prover.core.Goals;
import com.consullo.prover.core.MessageLevel;

/**
 * The user interface as seen by a session.
 *
 * <p>The session only pushes updates and never queries the display. Calls arrive on the session's
 * dispatcher thread; implementations that touch a UI toolkit must hand them off themselves.
 *
 * @since 1.0
 */
public interface DisplaySink {

  /**
   * Replaces the goal panel contents.
   *
   * @param goals current goals, or {@code null} when not inside a proof
   */
  void showGoals(Goals goals);

  void showMessage(MessageLevel level, String text);

  /** Empties the message panel. Sinks without a panel ignore it. */
  default void clearMessages() {
  }

  /**
   * Decorates a region.
   *
   * @param region document range
   * @param kind decoration
   * @return token that removes the decoration
   */
  HighlightHandle highlight(Region region, HighlightKind kind);

  /** The prover process is gone; the session accepts no more commands. */
  void connectionLost();
}
