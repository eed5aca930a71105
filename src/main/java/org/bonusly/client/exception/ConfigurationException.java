package org.bonusly.client.exception;

/**
 * Thrown when the client cannot be set up or used as configured: missing credential,
 * malformed base URL, invalid timeout or page size.
 */
public class ConfigurationException extends BonuslyClientException {

  /**
   * @param message The error message.
   */
  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }

  /**
   * @param message The error message.
   * @param cause   The underlying cause of the exception.
   */
  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
