package com.consullo.prover.text;

/**
 * Finds the end of a sentence by feeding characters one at a time.
 *
 * <p>A sentence ends with a dot or an ellipsis followed by whitespace or the end of a line, outside
 * comments and strings. Bullets ({@code -}, {@code +}, {@code *} runs) and braces are sentences of
 * their own when they lead. Comments nest; {@code '\n'} must be fed at the end of every line.
 *
 * @since 1.0
 */
final class SentenceEndMatcher {

  enum State {
    LEADING_SPACE,
    FREE,
    PRE_COMMENT,
    COMMENT,
    PRE_NESTED_COMMENT,
    POST_COMMENT,
    PRE_DOT,
    STRING,
    ELLIPSIS_1,
    ELLIPSIS_2,
    MINUS,
    PLUS,
    TIMES,
    BRACKET,
    FINAL
  }

  private State state = State.LEADING_SPACE;
  private State commentReturn = State.FREE;
  private int nesting;

  /**
   * Advances by one character.
   *
   * @param c next character
   * @return true if {@code c} completed a sentence
   */
  boolean feed(final char c) {
    state = next(c);
    return state == State.FINAL;
  }

  State state() {
    return state;
  }

  int nesting() {
    return nesting;
  }

  private State next(final char c) {
    switch (state) {
      case LEADING_SPACE:
        switch (c) {
          case ' ':
          case '\t':
          case '\n':
            return State.LEADING_SPACE;
          case '-':
            return State.MINUS;
          case '+':
            return State.PLUS;
          case '*':
            return State.TIMES;
          case '{':
          case '}':
            return State.BRACKET;
          default:
            return free(c);
        }
      case FREE:
        return free(c);
      case PRE_COMMENT:
        if (c == '*') {
          nesting = 1;
          return State.COMMENT;
        }
        if (c == '(') {
          commentReturn = State.FREE;
          return State.PRE_COMMENT;
        }
        return c == '.' ? State.PRE_DOT : State.FREE;
      case COMMENT:
        return inComment(c);
      case PRE_NESTED_COMMENT:
        if (c == '*') {
          nesting++;
          return State.COMMENT;
        }
        return inComment(c);
      case POST_COMMENT:
        if (c == ')') {
          nesting--;
          return nesting == 0 ? commentReturn : State.COMMENT;
        }
        return c == '*' ? State.POST_COMMENT : inComment(c);
      case PRE_DOT:
        if (isBlank(c)) {
          return State.FINAL;
        }
        return c == '.' ? State.ELLIPSIS_1 : State.FREE;
      case STRING:
        return c == '"' ? State.FREE : State.STRING;
      case ELLIPSIS_1:
        return c == '.' ? State.ELLIPSIS_2 : State.FREE;
      case ELLIPSIS_2:
        return isBlank(c) ? State.FINAL : State.FREE;
      case MINUS:
        return c == '-' ? State.MINUS : State.FINAL;
      case PLUS:
        return c == '+' ? State.PLUS : State.FINAL;
      case TIMES:
        return c == '*' ? State.TIMES : State.FINAL;
      case BRACKET:
      case FINAL:
      default:
        return State.FINAL;
    }
  }

  private State free(final char c) {
    switch (c) {
      case '(':
        commentReturn = state;
        return State.PRE_COMMENT;
      case '.':
        return State.PRE_DOT;
      case '"':
        return State.STRING;
      default:
        return State.FREE;
    }
  }

  private static State inComment(final char c) {
    switch (c) {
      case '*':
        return State.POST_COMMENT;
      case '(':
        return State.PRE_NESTED_COMMENT;
      default:
        return State.COMMENT;
    }
  }

  private static boolean isBlank(final char c) {
    return c == ' ' || c == '\t' || c == '\n';
  }
}
