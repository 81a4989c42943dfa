package com.consullo.prover.stm;

import com.consullo.prover.core.Flag;
import com.consullo.prover.core.Location;
import com.consullo.prover.core.Mark;
import com.consullo.prover.core.Sentence;
import com.consullo.prover.core.StateId;
import com.consullo.prover.display.DisplaySink;
import com.consullo.prover.display.HighlightHandle;
import com.consullo.prover.display.HighlightKind;
import com.consullo.prover.display.Region;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * One accepted sentence and its processing status.
 *
 * <p>A state owns the highlights drawn for it. Every flag change removes the previous highlights
 * before drawing new ones, and {@link #release()} removes them when the state leaves the history.
 *
 * <p>Not thread-safe; only the session's dispatcher thread touches states.
 *
 * @since 1.0
 */
public final class State {

  private final StateId id;
  private final Sentence sentence;
  private final List<HighlightHandle> highlights = new ArrayList<>(2);

  private volatile Flag flag = Flag.NONE;
  private volatile Location errorLocation;

  State(final StateId id, final Sentence sentence) {
    Validate.notNull(id, "id must not be null");
    this.id = id;
    this.sentence = sentence;
  }

  static State root(final StateId id) {
    return new State(id, null);
  }

  public StateId id() {
    return id;
  }

  /**
   * The sentence this state was created for.
   *
   * @return the sentence, {@code null} for the root state
   */
  public Sentence sentence() {
    return sentence;
  }

  public boolean isRoot() {
    return sentence == null;
  }

  public Flag flag() {
    return flag;
  }

  public boolean hasError() {
    return flag == Flag.ERROR;
  }

  /**
   * Range inside the sentence the prover blamed.
   *
   * @return offsets into the sentence text, {@code null} unless the flag is {@link Flag#ERROR}
   */
  public Location errorLocation() {
    return errorLocation;
  }

  /** Position right after this state's sentence, the origin for the root. */
  public Mark stop() {
    return sentence == null ? Mark.ORIGIN : sentence.stop();
  }

  void markSent(final DisplaySink display) {
    changeFlag(Flag.SENT, HighlightKind.SENT, display);
  }

  /**
   * Marks the state checked unless it is already an axiom or an error.
   *
   * @param display display that draws the highlight
   * @return true if the flag changed
   */
  boolean markVerified(final DisplaySink display) {
    if (flag != Flag.NONE && flag != Flag.SENT) {
      return false;
    }
    changeFlag(Flag.VERIFIED, HighlightKind.VERIFIED, display);
    return true;
  }

  boolean markAxiom(final DisplaySink display) {
    if (flag == Flag.AXIOM || flag == Flag.ERROR) {
      return false;
    }
    changeFlag(Flag.AXIOM, HighlightKind.AXIOM, display);
    return true;
  }

  /**
   * Marks the state failed. The whole sentence is highlighted as an error and a non-empty location
   * additionally highlights the blamed part.
   *
   * @param location offsets inside the sentence text, or {@code null}
   * @param display display that draws the highlights
   */
  void markError(final Location location, final DisplaySink display) {
    changeFlag(Flag.ERROR, HighlightKind.ERROR, display);
    errorLocation = location;
    if (location != null && !location.isEmpty() && sentence != null) {
      final Mark start = sentence.offsetToMark(location.start());
      final Mark stop = sentence.offsetToMark(location.stop());
      if (start.isBefore(stop)) {
        highlights.add(display.highlight(new Region(start, stop), HighlightKind.ERROR_PART));
      }
    }
  }

  /** Removes every highlight this state drew. */
  void release() {
    for (HighlightHandle handle : highlights) {
      handle.remove();
    }
    highlights.clear();
  }

  private void changeFlag(final Flag newFlag, final HighlightKind kind, final DisplaySink display) {
    release();
    flag = newFlag;
    errorLocation = null;
    if (sentence != null) {
      highlights.add(display.highlight(Region.of(sentence), kind));
    }
  }

  @Override
  public String toString() {
    return "State[" + id.value() + ", " + flag + (sentence == null ? ", root" : ", " + sentence.stop()) + "]";
  }
}
