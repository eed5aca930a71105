package org.bonusly.client.exception;

/**
 * Thrown when a 2xx response body is malformed or violates the envelope contract,
 * e.g. a success envelope without a result.
 */
public class DecodeException extends BonuslyClientException {

  /**
   * @param message The error message.
   */
  public DecodeException(String message) {
    super(ErrorKind.DECODE, message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public DecodeException(String message, Throwable cause) {
    super(ErrorKind.DECODE, message, cause);
  }
}
