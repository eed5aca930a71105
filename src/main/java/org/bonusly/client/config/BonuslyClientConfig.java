package org.bonusly.client.config;

import org.bonusly.client.BonuslyClient;
import org.bonusly.client.pagination.Paginator;
import org.bonusly.client.rest.Transport;
import org.bonusly.client.service.BonusService;
import org.bonusly.client.service.UserService;
import org.bonusly.client.service.WebhookService;
import org.bonusly.client.util.JsonUtils;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration of the Bonusly client from {@code bonusly.*} properties.
 * Every bean backs off when the application defines its own. Set {@code bonusly.enabled=false}
 * to switch the client off entirely; otherwise a missing token fails the context at startup.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = SettingsLoader.PREFIX, name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(BonuslyProperties.class)
public class BonuslyClientConfig {

  @Bean
  @ConditionalOnMissingBean
  public Transport bonuslyTransport(BonuslyProperties properties) {
    return Transport.create(properties, JsonUtils.newObjectMapper());
  }

  @Bean
  @ConditionalOnMissingBean
  public Paginator bonuslyPaginator(Transport transport) {
    return new Paginator(transport);
  }

  @Bean
  @ConditionalOnMissingBean
  public UserService bonuslyUserService(Transport transport, Paginator paginator) {
    return new UserService(transport, paginator);
  }

  @Bean
  @ConditionalOnMissingBean
  public BonusService bonuslyBonusService(Transport transport, Paginator paginator) {
    return new BonusService(transport, paginator);
  }

  @Bean
  @ConditionalOnMissingBean
  public WebhookService bonuslyWebhookService(Transport transport) {
    return new WebhookService(transport);
  }

  @Bean
  @ConditionalOnMissingBean
  public BonuslyClient bonuslyClient(Transport transport, Paginator paginator,
      UserService users, BonusService bonuses, WebhookService webhooks) {
    return new BonuslyClient(transport, paginator, users, bonuses, webhooks);
  }
}
