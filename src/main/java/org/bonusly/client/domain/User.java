package org.bonusly.client.domain;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * A Bonusly user as returned by {@code /users}. Fields the server may omit are nullable.
 */
@Builder
public record User(
    String id,
    String shortName,
    String fullName,
    String displayName,
    String username,
    String email,
    String path,
    URI fullPicUrl,
    URI profilePicUrl,
    String firstName,
    String lastName,
    Instant lastActiveAt,
    Instant createdAt,
    Long budgetBoost,
    UserMode userMode,
    String country,
    String timeZone,
    boolean canReceive,
    boolean canGive,
    List<Integer> giveAmounts,
    Map<String, Object> customProperties,
    String status,
    Long earningBalance,
    String earningBalanceWithCurrency,
    Long lifetimeEarnings,
    String lifetimeEarningsWithCurrency,
    Boolean admin
) {}
