package org.bonusly.client.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.exception.ApiException;
import org.bonusly.client.exception.DecodeException;
import org.bonusly.client.util.JsonUtils;

/**
 * Turns a raw response body into the typed result it carries, or into a classified error.
 */
@Slf4j
@RequiredArgsConstructor
public class EnvelopeDecoder {

  /** Detail used when a failure envelope carries no message. */
  public static final String NO_MESSAGE = "no message";

  private final ObjectMapper objectMapper;

  /**
   * Parses {@code body} as an {@link Envelope} whose result is of {@code resultType} and unwraps it.
   *
   * @param body       the raw response body, possibly empty
   * @param resultType the type of the {@code result} field
   * @param <T>        the result type
   * @return the result value, never null
   * @throws DecodeException if the body is blank, oversized or not an envelope of the expected shape
   * @throws ApiException if the envelope reports a failure
   */
  public <T> T decode(String body, JavaType resultType) {
    try {
      JsonUtils.validateJsonSize(body);
    } catch (IllegalArgumentException e) {
      throw new DecodeException("Response body rejected: " + e.getMessage(), e);
    }
    JavaType envelopeType =
        objectMapper.getTypeFactory().constructParametricType(Envelope.class, resultType);
    Envelope<T> envelope;
    try {
      envelope = objectMapper.readValue(body, envelopeType);
    } catch (JsonProcessingException e) {
      log.debug("Response body is not a {} envelope: {}", resultType.toCanonical(), e.getOriginalMessage());
      throw new DecodeException("Malformed response body: " + e.getOriginalMessage(), e);
    }
    if (envelope == null) {
      throw new DecodeException("Response body is JSON null; expected an envelope");
    }
    return unwrap(envelope);
  }

  /**
   * Maps an envelope onto its value or error. Total over all combinations of
   * {@code success} and payload presence.
   *
   * @param envelope the decoded envelope
   * @param <T>      the result type
   * @return the result when {@code success} is true
   * @throws DecodeException if {@code success} is missing, or true without a result
   * @throws ApiException if {@code success} is false
   */
  public static <T> T unwrap(Envelope<T> envelope) {
    if (envelope.success() == null) {
      throw new DecodeException("Response envelope has no 'success' flag");
    }
    if (envelope.success()) {
      if (envelope.result() == null || envelope.result() instanceof NullNode) {
        throw new DecodeException("Response envelope reports success but carries no result");
      }
      return envelope.result();
    }
    throw new ApiException(envelope.message() != null ? envelope.message() : NO_MESSAGE);
  }
}
