package com.consullo.prover.protocol;

/**
 * Raised when a wire element does not match any known shape.
 *
 * <p>This indicates a protocol version mismatch or a bug, never a recoverable prover answer.
 *
 * @since 1.0
 */
public class XmlDecodeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public XmlDecodeException(final String message) {
    super(message);
  }

  public XmlDecodeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
