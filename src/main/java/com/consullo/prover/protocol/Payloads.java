package com.consullo.prover.protocol;

/**
 * Shape checks for decoded answer payloads.
 */
final class Payloads {

  private Payloads() {
  }

  static <T> T as(final Object value, final Class<T> type, final String what) {
    if (!type.isInstance(value)) {
      throw new XmlDecodeException(what + ": expected " + type.getSimpleName() + " but got " + value);
    }
    return type.cast(value);
  }
}
