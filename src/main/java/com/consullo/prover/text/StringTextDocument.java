package com.consullo.prover.text;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * {@link TextDocument} over an in-memory string. Lines are split on {@code '\n'}.
 *
 * @since 1.0
 */
public final class StringTextDocument implements TextDocument {

  private final List<String> lines;

  public StringTextDocument(final String text) {
    Validate.notNull(text, "text must not be null");
    this.lines = List.of(text.split("\n", -1));
  }

  public StringTextDocument(final List<String> lines) {
    Validate.noNullElements(lines, "lines must not contain null");
    this.lines = List.copyOf(lines);
  }

  @Override
  public int lineCount() {
    return lines.size();
  }

  @Override
  public String line(final int line) {
    if (line < 1 || line > lines.size()) {
      throw new IndexOutOfBoundsException("line " + line + " of " + lines.size());
    }
    return lines.get(line - 1);
  }
}
