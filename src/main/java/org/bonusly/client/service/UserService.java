package org.bonusly.client.service;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.domain.User;
import org.bonusly.client.pagination.PageCursor;
import org.bonusly.client.pagination.Paginator;
import org.bonusly.client.rest.ApiConstants.ApiPath;
import org.bonusly.client.rest.Transport;
import org.bonusly.client.util.JsonUtils;
import reactor.core.publisher.Mono;

/**
 * Read access to Bonusly users.
 */
@Slf4j
@RequiredArgsConstructor
public class UserService {

  private final Transport transport;
  private final Paginator paginator;

  /**
   * All users matching {@code query}, fetched page by page with the configured page size.
   *
   * @param query filters such as {@code email}, {@code user_mode} or {@code include_archived};
   *              {@code skip} and {@code limit} must not be passed
   */
  public PageCursor<User> all(Map<String, ?> query) {
    log.debug("Listing users");
    return paginator.paginate(ApiPath.USERS, User.class, query);
  }

  public PageCursor<User> all(Map<String, ?> query, int pageSize) {
    log.debug("Listing users with page size {}", pageSize);
    return paginator.paginate(ApiPath.USERS, User.class, query, pageSize);
  }

  /**
   * Retrieves one user.
   *
   * @param id the user id
   * @return the user. An unknown id fails with {@code ApiException} when Bonusly answers with a
   *     {@code success: false} envelope ("not found"), or with {@code HttpStatusException} (404)
   *     when it answers with a 404 status
   */
  public Mono<User> get(String id) {
    JsonUtils.notBlank(id, "User id must not be blank");
    return transport.get(ApiPath.user(id), User.class);
  }
}
