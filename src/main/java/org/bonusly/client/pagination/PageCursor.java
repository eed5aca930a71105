package org.bonusly.client.pagination;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongFunction;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.exception.BonuslyClientException;
import org.bonusly.client.exception.DecodeException;
import org.bonusly.client.exception.TransportException;
import org.bonusly.client.rest.ErrorTranslator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A lazily fetched, single-pass sequence over one paginated collection.
 *
 * <p>Items are handed out in server order from a local buffer. When the buffer runs dry the next
 * page is requested with {@code skip} advanced by the number of items received so far. The
 * sequence ends after an empty page, or right after a page shorter than the page size has been
 * drained. The first failure is terminal: every later pull signals the same exception again
 * without touching the network.
 *
 * <p>A cursor has exactly one consumer. Pick one of {@link #next()}, {@link #flux()},
 * {@link #stream()} or {@link #collectList()} and stick to it; a pull issued while another one
 * is still waiting for its page fails with {@link IllegalStateException}. Cancelling a pull while
 * its page request is in flight aborts the cursor with a {@link TransportException}.
 *
 * @param <E> item type
 */
@Slf4j
public class PageCursor<E> {

  private final String path;
  private final int pageSize;
  private final LongFunction<Mono<List<E>>> pageFetcher;

  private final Deque<E> buffer = new ArrayDeque<>();
  private final AtomicBoolean busy = new AtomicBoolean();
  private volatile long skip;
  private volatile boolean exhausted;
  private volatile int fetchCount;
  private volatile BonuslyClientException failure;

  /**
   * @param path        collection path, used in log and error messages
   * @param pageSize    number of items requested per page, positive
   * @param pageFetcher requests the page starting at the given offset
   */
  PageCursor(String path, int pageSize, LongFunction<Mono<List<E>>> pageFetcher) {
    this.path = path;
    this.pageSize = pageSize;
    this.pageFetcher = pageFetcher;
  }

  /**
   * Pulls the next item.
   *
   * @return a {@link Mono} emitting the next item, completing empty once the collection is
   *     exhausted, or failing with a {@link BonuslyClientException}
   */
  public Mono<E> next() {
    return Mono.defer(this::pull);
  }

  /**
   * Reactive view of the remaining items. Pages are requested only as items are consumed, so
   * cancelling the subscription (for example with {@code take(n)}) stops further requests.
   */
  public Flux<E> flux() {
    return Mono.defer(() -> next().map(Optional::of).defaultIfEmpty(Optional.empty()))
        .repeat()
        .takeWhile(Optional::isPresent)
        .map(Optional::get);
  }

  /**
   * Blocking view of the remaining items. The stream is lazy: short-circuiting operations such
   * as {@code limit(n)} or {@code findFirst()} stop further page requests. Failures are thrown
   * from the terminal operation. Must not be used on a Reactor non-blocking thread.
   */
  public Stream<E> stream() {
    Iterator<E> iterator = new Iterator<>() {
      private E lookahead;
      private boolean done;

      @Override
      public boolean hasNext() {
        if (lookahead != null) {
          return true;
        }
        if (done) {
          return false;
        }
        lookahead = PageCursor.this.next().block();
        done = lookahead == null;
        return !done;
      }

      @Override
      public E next() {
        if (!hasNext()) {
          throw new NoSuchElementException("Collection " + path + " is exhausted");
        }
        E item = lookahead;
        lookahead = null;
        return item;
      }
    };
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /**
   * Drains the remaining items into a list.
   */
  public Mono<List<E>> collectList() {
    return flux().collectList();
  }

  /** Number of page requests issued so far. */
  public int fetchCount() {
    return fetchCount;
  }

  /** Number of items received from the server so far, i.e. the {@code skip} of the next page. */
  public long offset() {
    return skip;
  }

  /** Whether the last page has been received; buffered items may still remain. */
  public boolean isExhausted() {
    return exhausted;
  }

  public int pageSize() {
    return pageSize;
  }

  private Mono<E> pull() {
    if (!busy.compareAndSet(false, true)) {
      return Mono.error(new IllegalStateException(
          "A pull on " + path + " is already in progress; a page cursor supports a single consumer"));
    }
    if (failure != null) {
      busy.set(false);
      return Mono.error(failure);
    }
    E item = buffer.poll();
    if (item != null) {
      busy.set(false);
      return Mono.just(item);
    }
    if (exhausted) {
      busy.set(false);
      return Mono.empty();
    }
    return fetch();
  }

  // Runs with busy held. Busy is released before the item is emitted, so a consumer may pull
  // again from within onNext.
  private Mono<E> fetch() {
    long offset = skip;
    AtomicBoolean settled = new AtomicBoolean();
    fetchCount++;
    log.debug("Fetching {} skip={} limit={}", path, offset, pageSize);
    return pageFetcher.apply(offset)
        .doOnNext(page -> settled.set(true))
        .flatMap(page -> {
          accept(page, offset);
          E item = buffer.poll();
          busy.set(false);
          return Mono.justOrEmpty(item);
        })
        .onErrorMap(e -> ErrorTranslator.translate(e, "GET " + path))
        .doOnError(e -> {
          settled.set(true);
          failure = (BonuslyClientException) e;
          log.warn("Pagination over {} failed at skip={}: {}", path, offset, e.getMessage());
          busy.set(false);
        })
        .doOnCancel(() -> {
          if (settled.compareAndSet(false, true)) {
            failure = new TransportException("Page request GET " + path + " at skip=" + offset + " was cancelled");
            log.warn("Pagination over {} aborted: page request at skip={} cancelled", path, offset);
            busy.set(false);
          }
        });
  }

  private void accept(List<E> page, long offset) {
    if (page.isEmpty()) {
      exhausted = true;
      log.debug("Collection {} exhausted after {} items and {} requests", path, offset, fetchCount);
      return;
    }
    if (page.contains(null)) {
      throw new DecodeException("Page of " + path + " at skip=" + offset + " contains a null item");
    }
    buffer.addAll(page);
    skip = offset + page.size();
    if (page.size() < pageSize) {
      exhausted = true;
      log.debug("Short page of {} items ends collection {} at {} items", page.size(), path, skip);
    }
  }
}
