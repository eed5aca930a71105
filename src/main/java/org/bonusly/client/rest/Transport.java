package org.bonusly.client.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.netty.channel.ChannelOption;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.bonusly.client.config.BonuslyProperties;
import org.bonusly.client.exception.BonuslyClientException;
import org.bonusly.client.exception.DecodeException;
import org.bonusly.client.exception.HttpStatusException;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Performs single HTTP calls against the Bonusly API and decodes the envelope of the response.
 *
 * <p>Every call is asynchronous and lazy: nothing is sent until the returned {@link Mono} is
 * subscribed. Failures are always signalled as a {@link BonuslyClientException}:
 * <ul>
 *   <li>no response (DNS, connect, I/O, timeout): {@code TransportException}</li>
 *   <li>non-2xx status: {@code HttpStatusException}, the body is not read</li>
 *   <li>2xx body that is not an envelope of the expected type: {@code DecodeException}</li>
 *   <li>envelope with {@code success: false}: {@code ApiException}</li>
 * </ul>
 *
 * <p>The instance holds no mutable state and is safe to share between any number of concurrent
 * requests. Paths must already be URL-encoded; {@link ApiConstants.ApiPath} builds them that way.
 * Query keys and values are percent-encoded here, {@code +} included.
 */
@Slf4j
public class Transport {

  private final BonuslyProperties settings;
  private final ObjectMapper objectMapper;
  private final EnvelopeDecoder decoder;
  private final WebClient webClient;

  /**
   * Creates a transport on a Reactor Netty connector configured from {@code settings}.
   *
   * @throws org.bonusly.client.exception.ConfigurationException if the settings are invalid
   */
  public static Transport create(BonuslyProperties settings, ObjectMapper objectMapper) {
    settings.validate();
    HttpClient httpClient = HttpClient.create()
        .compress(settings.compression())
        .responseTimeout(settings.timeout())
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
            (int) Math.min(Integer.MAX_VALUE, settings.timeout().toMillis()));
    return new Transport(settings, objectMapper,
        WebClient.builder().clientConnector(new ReactorClientHttpConnector(httpClient)));
  }

  /**
   * Creates a transport on top of an existing {@link WebClient.Builder}, which is copied and not
   * modified. Authentication and JSON headers are added here.
   *
   * @throws org.bonusly.client.exception.ConfigurationException if the settings are invalid
   */
  public Transport(BonuslyProperties settings, ObjectMapper objectMapper, WebClient.Builder webClientBuilder) {
    this.settings = settings.validate();
    this.objectMapper = objectMapper;
    this.decoder = new EnvelopeDecoder(objectMapper);
    this.webClient = webClientBuilder.clone()
        .defaultHeaders(headers -> {
          headers.setBearerAuth(settings.token());
          headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        })
        .build();
    log.info("Bonusly transport ready: {}", settings);
  }

  public BonuslyProperties settings() {
    return settings;
  }

  public TypeFactory typeFactory() {
    return objectMapper.getTypeFactory();
  }

  public <T> Mono<T> get(String path, Class<T> resultType) {
    return get(path, Map.of(), typeFactory().constructType(resultType));
  }

  public <T> Mono<T> get(String path, Map<String, ?> query, JavaType resultType) {
    return request(HttpMethod.GET, path, query, null, resultType);
  }

  public <T> Mono<T> post(String path, Object body, Class<T> resultType) {
    return request(HttpMethod.POST, path, Map.of(), body, typeFactory().constructType(resultType));
  }

  public <T> Mono<T> put(String path, Object body, Class<T> resultType) {
    return request(HttpMethod.PUT, path, Map.of(), body, typeFactory().constructType(resultType));
  }

  public <T> Mono<T> delete(String path, Class<T> resultType) {
    return request(HttpMethod.DELETE, path, Map.of(), null, typeFactory().constructType(resultType));
  }

  /**
   * Sends one request and decodes the envelope of its response.
   *
   * @param method     HTTP method
   * @param path       encoded path relative to the base URL, e.g. {@code /users/abc}
   * @param query      query parameters; {@code null} values are skipped
   * @param body       JSON body for POST/PUT, or {@code null} for none
   * @param resultType type of the envelope's {@code result}
   * @param <T>        result type
   * @return a cold {@link Mono} emitting the result or a classified error
   */
  public <T> Mono<T> request(
      HttpMethod method, String path, Map<String, ?> query, @Nullable Object body, JavaType resultType) {
    String operation = method.name() + " " + path;
    return Mono.defer(() -> {
          URI uri = uri(path, query);
          WebClient.RequestBodySpec spec = webClient.method(method).uri(uri);
          WebClient.RequestHeadersSpec<?> request = body == null
              ? spec
              : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(serialize(body, operation));
          log.debug("Sending {}", operation);
          return request.exchangeToMono(response -> this.<T>handle(response, operation, resultType));
        })
        .timeout(settings.timeout())
        .onErrorMap(e -> !(e instanceof BonuslyClientException), e -> ErrorTranslator.translate(e, operation))
        .doOnError(e -> log.warn("{} failed: {}", operation, e.getMessage()));
  }

  private <T> Mono<T> handle(ClientResponse response, String operation, JavaType resultType) {
    HttpStatusCode status = response.statusCode();
    log.debug("{} answered {}", operation, status.value());
    if (!status.is2xxSuccessful()) {
      return response.releaseBody()
          .then(Mono.error(new HttpStatusException(status.value(), "HTTP " + status.value() + " from " + operation)));
    }
    return response.bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> decoder.<T>decode(body, resultType));
  }

  URI uri(String path, Map<String, ?> query) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(settings.baseUrl()).path(path);
    query.forEach((key, value) -> {
      if (value != null) {
        builder.queryParam(
            UriUtils.encode(key, StandardCharsets.UTF_8),
            UriUtils.encode(String.valueOf(value), StandardCharsets.UTF_8));
      }
    });
    return builder.build(true).toUri();
  }

  private String serialize(Object body, String operation) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new DecodeException("Cannot encode request body of " + operation + " as JSON", e);
    }
  }
}
