package com.consullo.prover.protocol;

import org.apache.commons.lang3.Validate;

/**
 * Outcome of one request/response exchange: either a decoded value or a {@link ProtocolError}.
 *
 * @param <T> value type of a successful answer
 * @since 1.0
 */
public final class CallResult<T> {

  private final T value;
  private final ProtocolError error;

  private CallResult(final T value, final ProtocolError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> CallResult<T> good(final T value) {
    return new CallResult<>(value, null);
  }

  public static <T> CallResult<T> fail(final ProtocolError error) {
    Validate.notNull(error, "error must not be null");
    return new CallResult<>(null, error);
  }

  public boolean isGood() {
    return error == null;
  }

  /**
   * Returns the decoded value.
   *
   * @return the value of a good answer
   * @throws IllegalStateException if the answer was a failure
   */
  public T value() {
    Validate.validState(error == null, "call failed: %s", error);
    return value;
  }

  /**
   * Returns the failure.
   *
   * @return the error of a failed answer
   * @throws IllegalStateException if the answer was good
   */
  public ProtocolError error() {
    Validate.validState(error != null, "call succeeded");
    return error;
  }

  @Override
  public String toString() {
    return isGood() ? "CallResult[good=" + value + "]" : "CallResult[fail=" + error + "]";
  }
}
