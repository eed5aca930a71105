package org.bonusly.client.pagination;

import com.fasterxml.jackson.databind.JavaType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.exception.ConfigurationException;
import org.bonusly.client.rest.ApiConstants;
import org.bonusly.client.rest.ApiConstants.QueryParam;
import org.bonusly.client.rest.Transport;

/**
 * Turns a {@code skip}/{@code limit} list endpoint into a {@link PageCursor}.
 * Stateless; every call creates an independent cursor.
 */
@Slf4j
@RequiredArgsConstructor
public class Paginator {

  private final Transport transport;

  /**
   * Paginates with the configured default page size.
   *
   * @see #paginate(String, Class, Map, int)
   */
  public <E> PageCursor<E> paginate(String path, Class<E> elementType, Map<String, ?> query) {
    return paginate(path, elementType, query, transport.settings().pageSize());
  }

  /**
   * Creates a cursor over the collection at {@code path}. Nothing is requested until the first
   * pull.
   *
   * @param path        encoded collection path, e.g. {@code /users}
   * @param elementType type of one item of the collection
   * @param query       filter parameters sent with every page request; {@code skip} and
   *                    {@code limit} are owned by the cursor and dropped if present
   * @param pageSize    items per page request
   * @param <E>         item type
   * @return a fresh cursor positioned before the first item
   * @throws ConfigurationException if {@code pageSize} is not positive or exceeds
   *     {@link ApiConstants#MAX_PAGE_SIZE}
   */
  public <E> PageCursor<E> paginate(String path, Class<E> elementType, Map<String, ?> query, int pageSize) {
    if (pageSize <= 0 || pageSize > ApiConstants.MAX_PAGE_SIZE) {
      throw new ConfigurationException(
          "Page size must be between 1 and " + ApiConstants.MAX_PAGE_SIZE + ", was " + pageSize);
    }
    Map<String, Object> filters = new LinkedHashMap<>();
    if (query != null) {
      filters.putAll(query);
    }
    for (String reserved : List.of(QueryParam.SKIP, QueryParam.LIMIT)) {
      if (filters.containsKey(reserved)) {
        log.warn("Ignoring caller supplied '{}' for {}; the page cursor sets it", reserved, path);
        filters.remove(reserved);
      }
    }

    JavaType pageType = transport.typeFactory().constructCollectionType(List.class, elementType);
    return new PageCursor<>(path, pageSize, skip -> {
      Map<String, Object> pageQuery = new LinkedHashMap<>(filters);
      pageQuery.put(QueryParam.SKIP, skip);
      pageQuery.put(QueryParam.LIMIT, pageSize);
      return transport.get(path, pageQuery, pageType);
    });
  }
}
