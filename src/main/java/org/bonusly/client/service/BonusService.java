package org.bonusly.client.service;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bonusly.client.domain.Bonus;
import org.bonusly.client.domain.CreateBonusRequest;
import org.bonusly.client.pagination.PageCursor;
import org.bonusly.client.pagination.Paginator;
import org.bonusly.client.rest.ApiConstants.ApiPath;
import org.bonusly.client.rest.Transport;
import org.bonusly.client.util.JsonUtils;
import reactor.core.publisher.Mono;

/**
 * Listing, retrieval and creation of bonuses.
 */
@Slf4j
@RequiredArgsConstructor
public class BonusService {

  private final Transport transport;
  private final Paginator paginator;

  /**
   * All bonuses visible to the token, newest first.
   *
   * @param query filters such as {@code start_time}, {@code giver_email} or {@code hashtag};
   *              {@code skip} and {@code limit} must not be passed
   */
  public PageCursor<Bonus> all(Map<String, ?> query) {
    log.debug("Listing bonuses");
    return paginator.paginate(ApiPath.BONUSES, Bonus.class, query);
  }

  public PageCursor<Bonus> all(Map<String, ?> query, int pageSize) {
    log.debug("Listing bonuses with page size {}", pageSize);
    return paginator.paginate(ApiPath.BONUSES, Bonus.class, query, pageSize);
  }

  /**
   * Bonuses given or received by one user.
   */
  public PageCursor<Bonus> forUser(String userId, Map<String, ?> query) {
    JsonUtils.notBlank(userId, "User id must not be blank");
    log.debug("Listing bonuses of user {}", userId);
    return paginator.paginate(ApiPath.userBonuses(userId), Bonus.class, query);
  }

  public PageCursor<Bonus> forUser(String userId, Map<String, ?> query, int pageSize) {
    JsonUtils.notBlank(userId, "User id must not be blank");
    log.debug("Listing bonuses of user {} with page size {}", userId, pageSize);
    return paginator.paginate(ApiPath.userBonuses(userId), Bonus.class, query, pageSize);
  }

  public Mono<Bonus> get(String id) {
    JsonUtils.notBlank(id, "Bonus id must not be blank");
    return transport.get(ApiPath.bonus(id), Bonus.class);
  }

  /**
   * Gives a bonus, in either the simple or the expanded form of {@link CreateBonusRequest}.
   *
   * @param request the bonus to give
   * @return the created bonus
   * @throws IllegalArgumentException if the request has no reason, or the expanded form is
   *     incomplete
   */
  public Mono<Bonus> create(CreateBonusRequest request) {
    validateNewBonus(request);
    log.info("Creating bonus for {}", StringUtils.defaultIfEmpty(request.receiverEmail(), "receivers named in the reason"));
    return transport.post(ApiPath.BONUSES, request, Bonus.class);
  }

  private void validateNewBonus(CreateBonusRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Bonus request must not be null");
    }
    JsonUtils.notBlank(request.reason(), "Bonus reason must not be blank");
    boolean expanded = request.receiverEmail() != null || request.amount() != null;
    if (expanded) {
      JsonUtils.notBlank(request.receiverEmail(), "Expanded bonus requires a receiver email");
      if (request.amount() == null || request.amount() <= 0) {
        throw new IllegalArgumentException("Expanded bonus requires a positive amount");
      }
    }
  }
}
