package org.bonusly.client.exception;

/**
 * Thrown when a request never produced an HTTP response: DNS or connect failure, broken
 * connection, timeout, or a page request that was cancelled while in flight.
 */
public class TransportException extends BonuslyClientException {

  /**
   * @param message The error message.
   */
  public TransportException(String message) {
    super(ErrorKind.TRANSPORT, message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public TransportException(String message, Throwable cause) {
    super(ErrorKind.TRANSPORT, message, cause);
  }
}
