package com.consullo.prover.core;

/**
 * Character range reported by the prover, relative to the start of a sentence.
 *
 * @param start 0-based offset of the first character
 * @param stop 0-based offset just after the last character
 * @since 1.0
 */
public record Location(int start, int stop) {

  public boolean isEmpty() {
    return start >= stop;
  }
}
