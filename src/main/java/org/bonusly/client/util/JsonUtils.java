package org.bonusly.client.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * JSON helpers shared by the transport, the services and the tests.
 * <ul>
 *   <li>Factory for the {@link ObjectMapper} that matches the Bonusly wire format</li>
 *   <li>Size limit for response bodies</li>
 *   <li>Argument checks</li>
 * </ul>
 *
 * Bonusly speaks snake_case JSON with ISO-8601 timestamps; the mapper ignores properties it does
 * not know so that new server fields do not break old clients.
 * Maximum JSON size is limited to 10MB for safety.
 */
@Slf4j
@UtilityClass
public class JsonUtils {

  public static final int MAX_JSON_LENGTH = 10_000_000; // 10MB

  /**
   * Creates a mapper configured for the Bonusly wire format.
   *
   * @return a new, independently configurable mapper
   */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        // Add support for Java 8 Date/Time types
        .registerModule(new JavaTimeModule())
        // Use ISO-8601 date/time format (e.g., "2024-01-31T15:30:00Z") instead of numeric timestamps
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  }

  /**
   * Validates that the specified character sequence is neither null, empty, nor consisting only of
   * whitespace characters.
   *
   * @param <T> the character sequence type (String, StringBuilder, etc.)
   * @param chars the character sequence to check
   * @param message the error message if invalid
   * @return the validated sequence
   * @throws IllegalArgumentException if chars is null, empty or whitespace-only or if message is
   *     null or blank
   */
  public static <T extends CharSequence> T notBlank(T chars, String message) {

    if (StringUtils.isBlank(message)) {
      throw new IllegalArgumentException("Message must not be null or blank");
    }

    if (StringUtils.isBlank(chars)) {
      throw new IllegalArgumentException(message);
    }

    return chars;
  }

  /**
   * Validates that the JSON string is not blank and doesn't exceed maximum length.
   *
   * @param json the JSON string to validate
   * @throws IllegalArgumentException if json is blank or exceeds maximum length
   */
  public static void validateJsonSize(String json) {

    notBlank(json, "json must not be null or blank");

    if (json.length() > MAX_JSON_LENGTH) {
      log.warn("Rejecting JSON document of {} characters", json.length());
      throw new IllegalArgumentException(
          "JSON exceeds maximum allowed length of " + MAX_JSON_LENGTH + " characters");
    }
  }
}
