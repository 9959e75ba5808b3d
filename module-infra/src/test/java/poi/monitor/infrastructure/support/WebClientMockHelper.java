package poi.monitor.infrastructure.support;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/** Pre-configured WebClient mock chains for the HTTP adapter tests. */
public final class WebClientMockHelper {

  private WebClientMockHelper() {
    // Utility class - prevent instantiation
  }

  /** POST chain answering every bodiless request with {@code statusCode}. */
  public static WebClient webClientWithStatus(int statusCode) {
    WebClient.ResponseSpec responseSpec = responseSpec();
    when(responseSpec.toBodilessEntity())
        .thenReturn(Mono.just(ResponseEntity.status(statusCode).build()));
    return webClient(responseSpec);
  }

  /** POST chain failing with the given exception when the response is subscribed. */
  public static WebClient webClientThatFails(Throwable failure) {
    WebClient.ResponseSpec responseSpec = responseSpec();
    lenient().when(responseSpec.toBodilessEntity()).thenReturn(Mono.error(failure));
    lenient().when(responseSpec.bodyToMono(JsonNode.class)).thenReturn(Mono.error(failure));
    return webClient(responseSpec);
  }

  /** POST chain failing like {@code retrieve()} does on a non-2xx status. */
  public static WebClient webClientThatThrows(int statusCode, String statusText) {
    return webClientThatFails(
        new WebClientResponseException(statusCode, statusText, null, null, null));
  }

  /** POST chain answering successive JSON requests with {@code responses}, in order. */
  public static WebClient jsonWebClient(JsonNode first, JsonNode... rest) {
    WebClient.ResponseSpec responseSpec = responseSpec();
    @SuppressWarnings("unchecked")
    Mono<JsonNode>[] next =
        Arrays.stream(rest).map(Mono::just).toArray(Mono[]::new);
    when(responseSpec.bodyToMono(JsonNode.class)).thenReturn(Mono.just(first), next);
    return webClient(responseSpec);
  }

  private static WebClient.ResponseSpec responseSpec() {
    return mock(WebClient.ResponseSpec.class);
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static WebClient webClient(WebClient.ResponseSpec responseSpec) {
    WebClient.RequestBodyUriSpec requestBodyUriSpec = mock(WebClient.RequestBodyUriSpec.class);
    WebClient.RequestBodySpec requestBodySpec = mock(WebClient.RequestBodySpec.class);
    WebClient.RequestHeadersSpec requestHeadersSpec = mock(WebClient.RequestHeadersSpec.class);

    when(requestBodyUriSpec.uri(anyString())).thenReturn(requestBodySpec);
    when(requestBodySpec.bodyValue(any())).thenReturn(requestHeadersSpec);
    when(requestHeadersSpec.retrieve()).thenReturn(responseSpec);

    WebClient webClient = mock(WebClient.class);
    when(webClient.post()).thenReturn(requestBodyUriSpec);
    return webClient;
  }
}
