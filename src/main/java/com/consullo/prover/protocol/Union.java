package com.consullo.prover.protocol;

import org.apache.commons.lang3.Validate;

/**
 * A tagged two-way union value ({@code in_l} or {@code in_r}).
 *
 * @param side which arm holds the value
 * @param value the carried value
 * @since 1.0
 */
public record Union(Side side, Object value) {

  public enum Side {
    LEFT("in_l"),
    RIGHT("in_r");

    private final String wireName;

    Side(final String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }
  }

  public Union {
    Validate.notNull(side, "side must not be null");
    Validate.notNull(value, "value must not be null");
  }

  public static Union left(final Object value) {
    return new Union(Side.LEFT, value);
  }

  public static Union right(final Object value) {
    return new Union(Side.RIGHT, value);
  }

  public boolean isLeft() {
    return side == Side.LEFT;
  }
}
