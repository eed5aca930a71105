package org.bonusly.client.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.bonusly.client.exception.ConfigurationException;
import org.bonusly.client.exception.ErrorKind;
import org.bonusly.client.rest.ApiConstants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("BonuslyProperties")
class BonuslyPropertiesTest {

  private static BonuslyProperties settings(String baseUrl, String token, Duration timeout, int pageSize) {
    return new BonuslyProperties(baseUrl, token, timeout, true, pageSize);
  }

  @Test
  @DisplayName("withToken applies every default")
  void defaults() {
    BonuslyProperties properties = BonuslyProperties.withToken("abc");

    assertThat(properties.baseUrl()).isEqualTo("https://bonus.ly/api/v1");
    assertThat(properties.timeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(properties.compression()).isTrue();
    assertThat(properties.pageSize()).isEqualTo(20);
    assertThat(properties.validate()).isSameAs(properties);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   "})
  @DisplayName("requires a token")
  void missingToken(String token) {
    assertThatThrownBy(() -> BonuslyProperties.withToken(token).validate())
        .isInstanceOfSatisfying(ConfigurationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION))
        .hasMessageContaining("BONUSLY_TOKEN");
  }

  @ParameterizedTest
  @ValueSource(strings = {"abc def", "abc\ndef", "tökén"})
  @DisplayName("rejects tokens that cannot travel in a header")
  void unprintableToken(String token) {
    assertThatThrownBy(() -> BonuslyProperties.withToken(token).validate())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageNotContaining(token);
  }

  @ParameterizedTest
  @ValueSource(strings = {"bonus.ly/api/v1", "ftp://bonus.ly/api", "https://", "ht tp://bad", " "})
  @DisplayName("rejects base URLs that are not absolute http(s) URLs")
  void badBaseUrl(String baseUrl) {
    assertThatThrownBy(() -> settings(baseUrl, "abc", ApiConstants.REQUEST_TIMEOUT, 20).validate())
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  @DisplayName("accepts a plain http base URL")
  void httpBaseUrl() {
    assertThat(settings("http://localhost:8080/api/v1", "abc", ApiConstants.REQUEST_TIMEOUT, 20).validate())
        .isNotNull();
  }

  @Test
  @DisplayName("rejects non-positive timeouts and page sizes")
  void nonPositive() {
    assertThatThrownBy(() -> settings(ApiConstants.BASE_URL, "abc", Duration.ZERO, 20).validate())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("timeout");
    assertThatThrownBy(() -> settings(ApiConstants.BASE_URL, "abc", Duration.ofSeconds(-1), 20).validate())
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> settings(ApiConstants.BASE_URL, "abc", null, 20).validate())
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> settings(ApiConstants.BASE_URL, "abc", ApiConstants.REQUEST_TIMEOUT, 0).validate())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("page-size");
  }

  @Test
  @DisplayName("accepts page sizes up to the API limit and rejects larger ones")
  void pageSizeUpperBound() {
    assertThat(settings(ApiConstants.BASE_URL, "abc", ApiConstants.REQUEST_TIMEOUT, ApiConstants.MAX_PAGE_SIZE)
        .validate()).isNotNull();
    assertThatThrownBy(() -> settings(ApiConstants.BASE_URL, "abc", ApiConstants.REQUEST_TIMEOUT,
        ApiConstants.MAX_PAGE_SIZE + 1).validate())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("page-size")
        .hasMessageContaining("101");
  }

  @Test
  @DisplayName("never prints the token")
  void redactsToken() {
    assertThat(BonuslyProperties.withToken("super-secret").toString())
        .doesNotContain("super-secret")
        .contains("<redacted>");
    assertThat(BonuslyProperties.withToken(null).toString()).contains("<unset>");
  }
}
