package com.consullo.prover.core;

import java.util.Comparator;

/**
 * A 1-indexed (line, column) position in a text document.
 *
 * <p>Marks are ordered lexicographically by line, then column.
 *
 * @param line 1-indexed line number
 * @param col 1-indexed column number
 * @since 1.0
 */
public record Mark(int line, int col) implements Comparable<Mark> {

  /** The first position of every document. */
  public static final Mark ORIGIN = new Mark(1, 1);

  private static final Comparator<Mark> ORDER =
      Comparator.comparingInt(Mark::line).thenComparingInt(Mark::col);

  public Mark {
    if (line < 1 || col < 1) {
      throw new IllegalArgumentException("line/col must be positive: (" + line + ", " + col + ")");
    }
  }

  @Override
  public int compareTo(final Mark other) {
    return ORDER.compare(this, other);
  }

  public boolean isBefore(final Mark other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(final Mark other) {
    return compareTo(other) > 0;
  }

  @Override
  public String toString() {
    return "(" + line + ", " + col + ")";
  }
}
