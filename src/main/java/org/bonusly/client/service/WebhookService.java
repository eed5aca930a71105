package org.bonusly.client.service;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.domain.Webhook;
import org.bonusly.client.domain.WebhookRequest;
import org.bonusly.client.rest.ApiConstants.ApiPath;
import org.bonusly.client.rest.Transport;
import org.bonusly.client.util.JsonUtils;
import reactor.core.publisher.Mono;

/**
 * Management of webhook subscriptions. The webhook list is small and not paginated.
 */
@Slf4j
@RequiredArgsConstructor
public class WebhookService {

  private final Transport transport;

  public Mono<List<Webhook>> list() {
    log.debug("Listing webhooks");
    JavaType listType = transport.typeFactory().constructCollectionType(List.class, Webhook.class);
    return transport.get(ApiPath.WEBHOOKS, Map.of(), listType);
  }

  public Mono<Webhook> create(WebhookRequest request) {
    validate(request);
    log.info("Registering webhook for {}", request.url());
    return transport.post(ApiPath.WEBHOOKS, request, Webhook.class);
  }

  public Mono<Webhook> update(String id, WebhookRequest request) {
    JsonUtils.notBlank(id, "Webhook id must not be blank");
    validate(request);
    log.info("Updating webhook {}", id);
    return transport.put(ApiPath.webhook(id), request, Webhook.class);
  }

  /**
   * Removes a webhook.
   *
   * @return whatever the server reports as the result of the deletion
   */
  public Mono<JsonNode> delete(String id) {
    JsonUtils.notBlank(id, "Webhook id must not be blank");
    log.info("Removing webhook {}", id);
    return transport.delete(ApiPath.webhook(id), JsonNode.class);
  }

  private void validate(WebhookRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Webhook request must not be null");
    }
    JsonUtils.notBlank(request.url(), "Webhook url must not be blank");
  }
}
