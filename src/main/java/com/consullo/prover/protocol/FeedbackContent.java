package com.consullo.prover.protocol;

import com.consullo.prover.core.Location;
import com.consullo.prover.core.MessageLevel;

/**
 * Payload of a {@link Feedback}. The set of kinds is closed; consumers switch over {@link #kind()}.
 *
 * @since 1.0
 */
public interface FeedbackContent {

  /** Feedback kinds, with their {@code feedback_content/@val} wire names. */
  enum Kind {
    ADDED_AXIOM("addedaxiom"),
    PROCESSED("processed"),
    INCOMPLETE("incomplete"),
    IN_PROGRESS("inprogress"),
    PROCESSING_IN("processingin"),
    ERROR_MSG("errormsg"),
    MESSAGE("message"),
    FILE_DEPENDENCY("filedependency"),
    FILE_LOADED("fileloaded"),
    UNHANDLED(null);

    private final String wireName;

    Kind(final String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }

    static Kind fromWireName(final String wireName) {
      for (Kind kind : values()) {
        if (kind.wireName != null && kind.wireName.equals(wireName)) {
          return kind;
        }
      }
      return UNHANDLED;
    }
  }

  Kind kind();

  /** The sentence introduced an axiom or an admitted proof. */
  record AddedAxiom() implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.ADDED_AXIOM;
    }
  }

  /** The sentence has been fully checked. */
  record Processed() implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.PROCESSED;
    }
  }

  record Incomplete() implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.INCOMPLETE;
    }
  }

  /**
   * Number of sentences still being processed.
   *
   * @param pending pending count reported by the prover
   */
  record InProgress(int pending) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.IN_PROGRESS;
    }
  }

  /**
   * The state was handed to a worker.
   *
   * @param worker worker name, e.g. {@code "master"}
   */
  record ProcessingIn(String worker) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.PROCESSING_IN;
    }
  }

  /**
   * Legacy error notification.
   *
   * @param location offending range, never {@code null}
   * @param text error text
   */
  record ErrorMsg(Location location, String text) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.ERROR_MSG;
    }
  }

  /**
   * A leveled message.
   *
   * @param level severity
   * @param location offending range, or {@code null}
   * @param text rendered text with markup removed
   */
  record Message(MessageLevel level, Location location, String text) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.MESSAGE;
    }
  }

  /**
   * @param source file that declared the dependency, or {@code null}
   * @param dependency file depended upon
   */
  record FileDependency(String source, String dependency) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.FILE_DEPENDENCY;
    }
  }

  /**
   * @param module loaded module name
   * @param compiledFile compiled file it was loaded from
   */
  record FileLoaded(String module, String compiledFile) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.FILE_LOADED;
    }
  }

  /**
   * Any feedback the client does not model.
   *
   * @param type wire name of the content, or of the feedback object when not state-scoped
   * @param raw serialized XML, for diagnostics
   */
  record Unhandled(String type, String raw) implements FeedbackContent {
    @Override
    public Kind kind() {
      return Kind.UNHANDLED;
    }
  }
}
