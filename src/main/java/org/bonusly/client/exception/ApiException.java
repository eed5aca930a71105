package org.bonusly.client.exception;

/**
 * Thrown when a well-formed envelope reports {@code success: false}.
 * {@link #apiMessage()} is the server's message, unchanged.
 */
public class ApiException extends BonuslyClientException {

  private final String apiMessage;

  /**
   * @param apiMessage The message reported by the server.
   */
  public ApiException(String apiMessage) {
    super(ErrorKind.API, "Bonusly API reported an error: " + apiMessage);
    this.apiMessage = apiMessage;
  }

  public String apiMessage() {
    return apiMessage;
  }
}
