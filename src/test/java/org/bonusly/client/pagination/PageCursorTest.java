package org.bonusly.client.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.bonusly.client.exception.DecodeException;
import org.bonusly.client.exception.HttpStatusException;
import org.bonusly.client.exception.TransportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

@DisplayName("PageCursor")
class PageCursorTest {

  private final List<Long> requestedOffsets = new ArrayList<>();

  private PageCursor<Integer> cursorOver(int total, int pageSize) {
    List<Integer> items = IntStream.range(0, total).boxed().collect(Collectors.toList());
    return new PageCursor<>("/items", pageSize, skip -> {
      requestedOffsets.add(skip);
      int from = (int) Math.min(skip, total);
      return Mono.just(items.subList(from, Math.min(from + pageSize, total)));
    });
  }

  @Test
  @DisplayName("does nothing until the first pull")
  void lazy() {
    PageCursor<Integer> cursor = cursorOver(5, 2);

    assertThat(cursor.fetchCount()).isZero();
    assertThat(cursor.offset()).isZero();
    assertThat(cursor.isExhausted()).isFalse();
  }

  @Test
  @DisplayName("next() hands out items in order and completes empty at the end")
  void nextInOrder() {
    PageCursor<Integer> cursor = cursorOver(3, 2);

    StepVerifier.create(cursor.next()).expectNext(0).verifyComplete();
    StepVerifier.create(cursor.next()).expectNext(1).verifyComplete();
    StepVerifier.create(cursor.next()).expectNext(2).verifyComplete();
    StepVerifier.create(cursor.next()).verifyComplete();
    StepVerifier.create(cursor.next()).verifyComplete();

    assertThat(requestedOffsets).containsExactly(0L, 2L);
    assertThat(cursor.offset()).isEqualTo(3);
    assertThat(cursor.isExhausted()).isTrue();
  }

  @Test
  @DisplayName("serves buffered items without fetching")
  void buffered() {
    PageCursor<Integer> cursor = cursorOver(100, 10);

    StepVerifier.create(cursor.flux().take(10)).expectNextCount(10).verifyComplete();

    assertThat(cursor.fetchCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("stream().limit(k) stops fetching after k items")
  void streamIsLazy() {
    PageCursor<Integer> cursor = cursorOver(100, 10);

    List<Integer> firstThirteen = cursor.stream().limit(13).toList();

    assertThat(firstThirteen).containsExactlyElementsOf(IntStream.range(0, 13).boxed().toList());
    assertThat(cursor.fetchCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("stream() drains the whole collection")
  void streamDrains() {
    PageCursor<Integer> cursor = cursorOver(7, 3);

    assertThat(cursor.stream().toList()).hasSize(7);
    assertThat(requestedOffsets).containsExactly(0L, 3L, 6L);
  }

  @Test
  @DisplayName("advances by the number of items actually received")
  void advancesByReceivedCount() {
    List<Long> offsets = new ArrayList<>();
    PageCursor<String> cursor = new PageCursor<>("/items", 3, skip -> {
      offsets.add(skip);
      // server returns more than asked on the first page
      return Mono.just(skip == 0 ? List.of("a", "b", "c", "d") : List.of());
    });

    StepVerifier.create(cursor.collectList()).expectNext(List.of("a", "b", "c", "d")).verifyComplete();

    assertThat(offsets).containsExactly(0L, 4L);
  }

  @Test
  @DisplayName("a failed fetch is terminal and re-signalled without fetching again")
  void terminalFailure() {
    HttpStatusException failure = new HttpStatusException(502, "HTTP 502 from GET /items");
    List<Long> offsets = new ArrayList<>();
    PageCursor<Integer> cursor = new PageCursor<>("/items", 2, skip -> {
      offsets.add(skip);
      return skip == 0 ? Mono.just(List.of(1, 2)) : Mono.error(failure);
    });

    StepVerifier.create(cursor.flux())
        .expectNext(1, 2)
        .expectErrorSatisfies(e -> assertThat(e).isSameAs(failure))
        .verify();
    StepVerifier.create(cursor.next())
        .expectErrorSatisfies(e -> assertThat(e).isSameAs(failure))
        .verify();

    assertThat(offsets).containsExactly(0L, 2L);
  }

  @Test
  @DisplayName("unclassified fetch errors are translated")
  void translatesErrors() {
    PageCursor<Integer> cursor = new PageCursor<>("/items", 2, skip -> Mono.error(new TimeoutException()));

    StepVerifier.create(cursor.next()).expectError(TransportException.class).verify();
  }

  @Test
  @DisplayName("a page with a null item is a decode error")
  void nullItem() {
    List<Integer> page = new ArrayList<>();
    page.add(1);
    page.add(null);
    PageCursor<Integer> cursor = new PageCursor<>("/items", 5, skip -> Mono.just(page));

    StepVerifier.create(cursor.next()).expectError(DecodeException.class).verify();
  }

  @Test
  @DisplayName("rejects a second pull while a page request is in flight")
  void singleConsumer() {
    Sinks.One<List<Integer>> page = Sinks.one();
    PageCursor<Integer> cursor = new PageCursor<>("/items", 2, skip -> skip == 0 ? page.asMono() : Mono.just(List.of()));

    StepVerifier.create(cursor.next())
        .then(() -> StepVerifier.create(cursor.next()).expectError(IllegalStateException.class).verify())
        .then(() -> page.tryEmitValue(List.of(7, 8)))
        .expectNext(7)
        .verifyComplete();

    StepVerifier.create(cursor.next()).expectNext(8).verifyComplete();
    StepVerifier.create(cursor.next()).verifyComplete();
  }

  @Test
  @DisplayName("cancelling an in-flight page request aborts the cursor")
  void cancellationAborts() {
    PageCursor<Integer> cursor = new PageCursor<>("/items", 2, skip -> Mono.never());

    StepVerifier.create(cursor.next().timeout(Duration.ofMillis(50)))
        .expectError(TimeoutException.class)
        .verify(Duration.ofSeconds(5));

    StepVerifier.create(cursor.next())
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("cancelled"))
        .verify();
    assertThat(cursor.fetchCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("cancelling after the last item does not abort the cursor")
  void cancellationAfterItem() {
    PageCursor<Integer> cursor = cursorOver(5, 2);

    StepVerifier.create(cursor.flux().take(1)).expectNext(0).verifyComplete();

    StepVerifier.create(cursor.flux()).expectNext(1, 2, 3, 4).verifyComplete();
  }

  @Test
  @DisplayName("stream() throws the classified failure")
  void streamThrows() {
    PageCursor<Integer> cursor = new PageCursor<>("/items", 2,
        skip -> Mono.error(new HttpStatusException(401, "HTTP 401 from GET /items")));

    assertThatThrownBy(() -> cursor.stream().toList())
        .isInstanceOfSatisfying(HttpStatusException.class, e -> assertThat(e.statusCode()).isEqualTo(401));
  }
}
