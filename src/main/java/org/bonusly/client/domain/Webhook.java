package org.bonusly.client.domain;

import java.util.List;
import lombok.Builder;

/**
 * A registered webhook: Bonusly posts the listed event types to {@code url}.
 */
@Builder
public record Webhook(
    String id,
    String url,
    List<String> eventTypes
) {}
