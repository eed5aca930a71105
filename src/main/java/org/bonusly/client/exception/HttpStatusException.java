package org.bonusly.client.exception;

/**
 * Thrown when the server answers with a non-2xx status.
 * The response body is never decoded in that case.
 */
public class HttpStatusException extends BonuslyClientException {

  private final int statusCode;

  /**
   * @param statusCode The HTTP status code returned by the server.
   * @param message    The error message.
   */
  public HttpStatusException(int statusCode, String message) {
    super(ErrorKind.HTTP_STATUS, message);
    this.statusCode = statusCode;
  }

  /**
   * @param statusCode The HTTP status code returned by the server.
   * @param message    The error message.
   * @param cause      The underlying cause of the exception.
   */
  public HttpStatusException(int statusCode, String message, Throwable cause) {
    super(ErrorKind.HTTP_STATUS, message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
