package org.bonusly.client.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;
import org.bonusly.client.exception.ConfigurationException;
import org.bonusly.client.rest.ApiConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Client settings bound from {@code bonusly.*}: environment variables ({@code BONUSLY_TOKEN},
 * {@code BONUSLY_BASE_URL}, ...), application properties or an external settings file.
 * Immutable once bound and shared by every request of one client.
 *
 * @param baseUrl     API root, requests go to {@code baseUrl + path}
 * @param token       bearer credential; required and never printed
 * @param timeout     connect and response deadline of a single request
 * @param compression whether to ask for and inflate gzip responses
 * @param pageSize    default page size for paginated collections, at most {@value ApiConstants#MAX_PAGE_SIZE}
 */
@ConfigurationProperties(prefix = "bonusly")
public record BonuslyProperties(
    @DefaultValue(ApiConstants.BASE_URL) String baseUrl,
    String token,
    @DefaultValue("5s") Duration timeout,
    @DefaultValue("true") boolean compression,
    @DefaultValue("20") int pageSize
) {

  /**
   * Settings with every default and the given token.
   */
  public static BonuslyProperties withToken(String token) {
    return new BonuslyProperties(
        ApiConstants.BASE_URL, token, ApiConstants.REQUEST_TIMEOUT, true, ApiConstants.PAGE_SIZE);
  }

  /**
   * Checks the settings a client cannot work without.
   *
   * @return this instance
   * @throws ConfigurationException if a setting is missing or malformed
   */
  public BonuslyProperties validate() {
    if (StringUtils.isBlank(token)) {
      throw new ConfigurationException(
          "Missing Bonusly API token: set the BONUSLY_TOKEN environment variable or bonusly.token");
    }
    if (!token.chars().allMatch(c -> c > 0x20 && c < 0x7f)) {
      throw new ConfigurationException(
          "Bonusly API token contains characters that cannot be sent in an Authorization header");
    }
    validateBaseUrl();
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new ConfigurationException("bonusly.timeout must be positive, was " + timeout);
    }
    if (pageSize <= 0 || pageSize > ApiConstants.MAX_PAGE_SIZE) {
      throw new ConfigurationException(
          "bonusly.page-size must be between 1 and " + ApiConstants.MAX_PAGE_SIZE + ", was " + pageSize);
    }
    return this;
  }

  private void validateBaseUrl() {
    if (StringUtils.isBlank(baseUrl)) {
      throw new ConfigurationException("bonusly.base-url must not be blank");
    }
    try {
      URI uri = new URI(baseUrl);
      if (!"https".equalsIgnoreCase(uri.getScheme()) && !"http".equalsIgnoreCase(uri.getScheme())
          || uri.getHost() == null) {
        throw new ConfigurationException("bonusly.base-url must be an absolute http(s) URL: " + baseUrl);
      }
    } catch (URISyntaxException e) {
      throw new ConfigurationException("bonusly.base-url is not a valid URL: " + baseUrl, e);
    }
  }

  @Override
  public String toString() {
    return "BonuslyProperties[baseUrl=" + baseUrl
        + ", token=" + (StringUtils.isEmpty(token) ? "<unset>" : "<redacted>")
        + ", timeout=" + timeout
        + ", compression=" + compression
        + ", pageSize=" + pageSize + "]";
  }
}
