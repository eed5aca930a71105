package org.bonusly.client.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.bonusly.client.exception.BonuslyClientException;
import org.bonusly.client.exception.DecodeException;
import org.bonusly.client.exception.HttpStatusException;
import org.bonusly.client.exception.TransportException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Translates WebClient, Reactor Netty, Jackson and timeout exceptions into the client's error
 * taxonomy, so callers only ever see a {@link BonuslyClientException}.
 */
@Slf4j
@UtilityClass
public class ErrorTranslator {

  /**
   * @param e         the exception to translate
   * @param operation what was being done, e.g. {@code "GET /users"}; must not contain secrets
   * @return the classified exception in {@code e}'s cause chain if there is one, otherwise a
   *     classified wrapper
   */
  public static BonuslyClientException translate(Throwable e, String operation) {
    BonuslyClientException classified = ExceptionUtils.throwableOfType(e, BonuslyClientException.class);
    if (classified != null) {
      return classified;
    }

    BonuslyClientException translated;
    if (e instanceof TimeoutException) {
      translated = new TransportException(operation + " timed out", e);
    } else if (ExceptionUtils.indexOfType(e, CodecException.class) >= 0
        || ExceptionUtils.indexOfType(e, JsonProcessingException.class) >= 0) {
      translated = new DecodeException("Malformed response body from " + operation + ": " + rootMessage(e), e);
    } else if (e instanceof WebClientResponseException ex) {
      translated = new HttpStatusException(
          ex.getStatusCode().value(), "HTTP " + ex.getStatusCode().value() + " from " + operation, ex);
    } else if (e instanceof WebClientRequestException || e instanceof IOException) {
      translated = new TransportException(operation + " failed: " + rootMessage(e), e);
    } else {
      log.error("Unexpected error during {}", operation, e);
      translated = new TransportException(operation + " failed unexpectedly: " + rootMessage(e), e);
    }

    log.debug("Translated {} to {}", e.getClass().getSimpleName(), translated.getClass().getSimpleName());
    return translated;
  }

  private static String rootMessage(Throwable e) {
    Throwable root = ExceptionUtils.getRootCause(e);
    String message = (root != null ? root : e).getMessage();
    return message != null ? message : e.getClass().getSimpleName();
  }
}
