package com.consullo.prover.text;

/**
 * Read access to the lines of an editor buffer.
 *
 * @since 1.0
 */
public interface TextDocument {

  int lineCount();

  /**
   * Returns one line without its terminator.
   *
   * @param line 1-indexed line number
   * @return line text
   * @throws IndexOutOfBoundsException if the line does not exist
   */
  String line(int line);
}
