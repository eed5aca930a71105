package org.bonusly.client;

import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.config.BonuslyProperties;
import org.bonusly.client.config.SettingsLoader;
import org.bonusly.client.pagination.Paginator;
import org.bonusly.client.rest.Transport;
import org.bonusly.client.service.BonusService;
import org.bonusly.client.service.UserService;
import org.bonusly.client.service.WebhookService;
import org.bonusly.client.util.JsonUtils;

/**
 * Entry point of the Bonusly API client.
 *
 * <pre>{@code
 * BonuslyClient client = BonuslyClient.fromEnvironment();
 * List<User> firstTen = client.users().all(Map.of()).flux().take(10).collectList().block();
 * }</pre>
 *
 * <p>A client is immutable and thread-safe; share one per token.
 */
@Slf4j
public class BonuslyClient {

  private final Transport transport;
  private final Paginator paginator;
  private final UserService users;
  private final BonusService bonuses;
  private final WebhookService webhooks;

  public BonuslyClient(Transport transport) {
    this(transport, new Paginator(transport));
  }

  public BonuslyClient(Transport transport, Paginator paginator) {
    this(transport, paginator,
        new UserService(transport, paginator),
        new BonusService(transport, paginator),
        new WebhookService(transport));
  }

  public BonuslyClient(Transport transport, Paginator paginator,
      UserService users, BonusService bonuses, WebhookService webhooks) {
    this.transport = transport;
    this.paginator = paginator;
    this.users = users;
    this.bonuses = bonuses;
    this.webhooks = webhooks;
  }

  /**
   * @throws org.bonusly.client.exception.ConfigurationException if the settings are invalid
   */
  public static BonuslyClient create(BonuslyProperties settings) {
    return new BonuslyClient(Transport.create(settings, JsonUtils.newObjectMapper()));
  }

  /**
   * Client configured from {@code BONUSLY_*} environment variables or {@code bonusly.*} system
   * properties.
   *
   * @throws org.bonusly.client.exception.ConfigurationException if no token is set or a setting
   *     is malformed
   */
  public static BonuslyClient fromEnvironment() {
    return create(SettingsLoader.fromEnvironment());
  }

  /**
   * Client configured from a {@code .properties} or {@code .yml} file, with environment variables
   * taking precedence over its entries.
   *
   * @throws org.bonusly.client.exception.ConfigurationException if the file is unreadable, no
   *     token is set or a setting is malformed
   */
  public static BonuslyClient fromSettingsFile(Path settingsFile) {
    return create(SettingsLoader.fromSettingsFile(settingsFile));
  }

  /**
   * Client configured from the {@code .env} file of the working directory, with environment
   * variables taking precedence over its entries.
   *
   * @throws org.bonusly.client.exception.ConfigurationException if the file is unreadable, no
   *     token is set or a setting is malformed
   */
  public static BonuslyClient fromDotenv() {
    return create(SettingsLoader.fromDotenv());
  }

  public UserService users() {
    return users;
  }

  public BonusService bonuses() {
    return bonuses;
  }

  public WebhookService webhooks() {
    return webhooks;
  }

  public Paginator paginator() {
    return paginator;
  }

  public Transport transport() {
    return transport;
  }
}
