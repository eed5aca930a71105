package org.bonusly.client.rest;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.web.util.UriUtils;

public final class ApiConstants {
  public static final String BASE_URL = "https://bonus.ly/api/v1";
  public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);
  public static final int PAGE_SIZE = 20;
  /** Largest {@code limit} the API honours; a page size above it would read as a short last page. */
  public static final int MAX_PAGE_SIZE = 100;

  /** Request paths relative to the base URL; ids are encoded as single path segments. */
  public static final class ApiPath {
    public static final String USERS = "/users";
    public static final String BONUSES = "/bonuses";
    public static final String WEBHOOKS = "/webhooks";

    public static String user(String id) {
      return USERS + "/" + segment(id);
    }

    public static String userBonuses(String userId) {
      return user(userId) + BONUSES;
    }

    public static String bonus(String id) {
      return BONUSES + "/" + segment(id);
    }

    public static String webhook(String id) {
      return WEBHOOKS + "/" + segment(id);
    }

    private static String segment(String id) {
      return UriUtils.encodePathSegment(id, StandardCharsets.UTF_8);
    }

    private ApiPath() {}
  }

  /** Query keys owned by the paginator. */
  public static final class QueryParam {
    public static final String SKIP = "skip";
    public static final String LIMIT = "limit";

    private QueryParam() {}
  }

  private ApiConstants() {}
}
