package com.consullo.prover.core;

import org.apache.commons.lang3.Validate;

/**
 * An immutable span of proof-script text delimited by a sentence terminator.
 *
 * <p>Sentences are compared by value, so the same text at the same bounds is the same sentence.
 *
 * @param text raw text, including any leading whitespace and comments
 * @param start position of the first character
 * @param stop position just after the last character
 * @since 1.0
 */
public record Sentence(String text, Mark start, Mark stop) {

  public Sentence {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(start, "start must not be null");
    Validate.notNull(stop, "stop must not be null");
    Validate.isTrue(!stop.isBefore(start), "stop %s must not precede start %s", stop, start);
  }

  /**
   * Translates a character offset inside {@link #text()} into a document position.
   *
   * <p>Offsets past the end of the text are clamped to the end.
   *
   * @param offset 0-based character offset
   * @return the corresponding mark
   */
  public Mark offsetToMark(final int offset) {
    Validate.isTrue(offset >= 0, "offset must not be negative");
    final int limit = Math.min(offset, text.length());
    int line = start.line();
    int col = start.col();
    for (int i = 0; i < limit; i++) {
      if (text.charAt(i) == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }
    return new Mark(line, col);
  }
}
