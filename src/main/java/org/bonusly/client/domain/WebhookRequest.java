package org.bonusly.client.domain;

import java.util.List;
import lombok.Builder;

/** Body of a webhook create or update. */
@Builder
public record WebhookRequest(
    String url,
    List<String> eventTypes
) {}
