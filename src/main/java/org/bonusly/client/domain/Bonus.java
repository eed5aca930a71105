package org.bonusly.client.domain;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder
public record Bonus(
    String id,
    Instant createdAt,
    String parentBonusId,
    String reason,
    String reasonDecoded,
    String reasonHtml,
    int amount,
    String amountWithCurrency,
    int familyAmount,
    String value,
    String hashtag,
    User giver,
    List<User> receivers
) {}
