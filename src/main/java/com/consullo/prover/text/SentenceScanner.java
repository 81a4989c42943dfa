package com.consullo.prover.text;

import com.consullo.prover.core.Mark;
import com.consullo.prover.core.Sentence;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Cuts the next sentence out of a document.
 *
 * @since 1.0
 */
public final class SentenceScanner {

  /**
   * Finds the sentence that starts at {@code start}.
   *
   * <p>The sentence text runs from {@code start} up to, not including, the character that completed
   * the terminator; that character's position is the sentence stop. Leading whitespace and comments
   * belong to the sentence.
   *
   * @param document text to scan
   * @param start position to scan from; a column past the end of its line means the line end
   * @return the sentence, or empty if the document ends first
   */
  public Optional<Sentence> findSentenceAfter(final TextDocument document, final Mark start) {
    Validate.notNull(document, "document must not be null");
    Validate.notNull(start, "start must not be null");
    if (start.line() > document.lineCount()) {
      return Optional.empty();
    }
    final Mark origin = new Mark(start.line(), Math.min(start.col(), document.line(start.line()).length() + 1));
    final SentenceEndMatcher matcher = new SentenceEndMatcher();
    final StringBuilder text = new StringBuilder();
    for (int line = start.line(); line <= document.lineCount(); line++) {
      final String content = document.line(line);
      final int from = line == origin.line() ? origin.col() - 1 : 0;
      if (line != start.line()) {
        text.append('\n');
      }
      for (int i = from; i <= content.length(); i++) {
        final char c = i < content.length() ? content.charAt(i) : '\n';
        if (matcher.feed(c)) {
          return Optional.of(new Sentence(text.toString(), origin, new Mark(line, i + 1)));
        }
        if (i < content.length()) {
          text.append(c);
        }
      }
    }
    return Optional.empty();
  }
}
