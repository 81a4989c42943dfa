package com.consullo.prover.display;

import com.consullo.prover.core.Mark;
import com.consullo.prover.core.Sentence;
import org.apache.commons.lang3.Validate;

/**
 * A half-open range of document positions.
 *
 * @param start first position
 * @param stop position just after the last character
 * @since 1.0
 */
public record Region(Mark start, Mark stop) {

  public Region {
    Validate.notNull(start, "start must not be null");
    Validate.notNull(stop, "stop must not be null");
    Validate.isTrue(!stop.isBefore(start), "stop %s must not precede start %s", stop, start);
  }

  public static Region of(final Sentence sentence) {
    return new Region(sentence.start(), sentence.stop());
  }
}
