package com.consullo.prover.protocol;

/**
 * A request understood by the prover.
 *
 * @param <R> type of the value carried by a {@code good} answer
 * @since 1.0
 */
public interface ProverCall<R> {

  /**
   * Returns the {@code val} attribute of the {@code call} element, e.g. {@code "Add"}.
   *
   * @return call name
   */
  String name();

  /**
   * Returns the argument value, encoded with {@link XmlCodec} as the single child of the call.
   *
   * @return argument value
   */
  Object argument();

  /**
   * Interprets the decoded payload of a {@code good} answer.
   *
   * @param payload value decoded from the single child of the {@code value} element
   * @return typed answer
   * @throws XmlDecodeException if the payload does not have the expected shape
   */
  R interpret(Object payload);
}
