package poi.monitor.infrastructure.external.graphix;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.port.out.CandidateKeySource;
import poi.monitor.error.exception.DiscoveryException;
import poi.monitor.infrastructure.config.PoiMonitorProperties;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Discovers candidate keys through the Graphix GraphQL API.
 *
 * <h3>Flow</h3>
 *
 * <ol>
 *   <li>{@code indexers(limit)} lists the known indexer addresses
 *   <li>{@code poiAgreementRatios(indexerAddress)} per indexer yields the deployment/block pairs it
 *       submitted POIs for
 * </ol>
 *
 * <p>Keys keep their first-seen order. Any transport failure, GraphQL error or unexpected response
 * shape raises {@link DiscoveryException}. A single malformed POI row is logged and skipped. The
 * circuit breaker {@code graphixApi} turns repeated failures into an immediate {@link
 * DiscoveryException}.
 */
@Slf4j
@Component
public class GraphixDiscoveryClient implements CandidateKeySource {

  static final String CIRCUIT_BREAKER = "graphixApi";

  static final String INDEXERS_QUERY =
      "query Indexers($limit: Int) { indexers(limit: $limit) { address } }";

  /**
   * {@code indexerAddress} is an {@code IndexerAddress} scalar on the server, so the address is
   * inlined as a quoted string literal instead of being declared as a typed variable.
   */
  static final String AGREEMENTS_QUERY_TEMPLATE =
      "query { poiAgreementRatios(indexerAddress: %s) {"
          + " poi { hash block { number } deployment { cid } indexer { address } } } }";

  private final WebClient graphixWebClient;
  private final LogicExecutor executor;
  private final PoiMonitorProperties properties;

  public GraphixDiscoveryClient(
      @Qualifier("graphixWebClient") WebClient graphixWebClient,
      LogicExecutor executor,
      PoiMonitorProperties properties) {
    this.graphixWebClient = graphixWebClient;
    this.executor = executor;
    this.properties = properties;
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "discoveryFallback")
  public List<DeploymentBlock> fetchCandidateKeys() {
    List<String> indexers =
        executor.executeWithTranslation(
            this::fetchIndexers,
            ExceptionTranslator.forDiscovery(),
            TaskContext.of("Graphix", "indexers"));
    if (indexers.isEmpty()) {
      log.warn("[Graphix] No indexers found");
      return List.of();
    }

    Set<DeploymentBlock> keys = new LinkedHashSet<>();
    for (String indexer : indexers) {
      keys.addAll(
          executor.executeWithTranslation(
              () -> fetchAgreements(indexer),
              ExceptionTranslator.forDiscovery(),
              TaskContext.of("Graphix", "agreements", indexer)));
    }
    log.info("[Graphix] Discovered {} candidate keys from {} indexers", keys.size(), indexers.size());
    return List.copyOf(keys);
  }

  private List<String> fetchIndexers() {
    JsonNode data =
        query(INDEXERS_QUERY, Map.of("limit", properties.getGraphix().getPageSize()), "indexers");

    List<String> addresses = new ArrayList<>(data.size());
    for (JsonNode indexer : data) {
      addresses.add(requireText(indexer.path("address"), "indexers[].address"));
    }
    return addresses;
  }

  private List<DeploymentBlock> fetchAgreements(String indexerAddress) {
    log.debug("[Graphix] Fetching POIs for indexer {}", indexerAddress);
    JsonNode data = query(agreementsQuery(indexerAddress), Map.of(), "poiAgreementRatios");

    List<DeploymentBlock> keys = new ArrayList<>(data.size());
    for (JsonNode agreement : data) {
      toKey(agreement.path("poi"))
          .ifPresentOrElse(
              keys::add,
              () ->
                  log.warn(
                      "[Graphix] Skipping malformed POI row of indexer {}: {}",
                      indexerAddress,
                      agreement));
    }
    return keys;
  }

  static String agreementsQuery(String indexerAddress) {
    return String.format(AGREEMENTS_QUERY_TEMPLATE, TextNode.valueOf(indexerAddress));
  }

  /** Empty for a row without a cid or with a missing, non-integral or negative block number. */
  private static Optional<DeploymentBlock> toKey(JsonNode poi) {
    JsonNode cid = poi.path("deployment").path("cid");
    JsonNode number = poi.path("block").path("number");
    if (!cid.isTextual() || cid.asText().isBlank()) {
      return Optional.empty();
    }
    if (!number.isIntegralNumber() || !number.canConvertToLong() || number.asLong() < 0) {
      return Optional.empty();
    }
    return Optional.of(DeploymentBlock.of(cid.asText(), number.asLong()));
  }

  /** Posts a GraphQL request and returns {@code data.<field>}, which must be an array. */
  private JsonNode query(String query, Map<String, Object> variables, String field) {
    JsonNode response =
        graphixWebClient
            .post()
            .uri(properties.getGraphix().getUrl())
            .bodyValue(Map.of("query", query, "variables", variables))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .block(properties.getGraphix().getTimeout());

    if (response == null) {
      throw new DiscoveryException("empty response for " + field);
    }
    if (response.hasNonNull("errors")) {
      throw new DiscoveryException("GraphQL errors: " + response.get("errors"));
    }
    JsonNode data = response.path("data").path(field);
    if (!data.isArray()) {
      throw new DiscoveryException("unexpected response format, missing data." + field);
    }
    return data;
  }

  private static String requireText(JsonNode node, String path) {
    if (!node.isTextual() || node.asText().isBlank()) {
      throw new DiscoveryException(path + " is missing");
    }
    return node.asText();
  }

  /** Keeps the failure contract when the circuit is open or the call failed. */
  private List<DeploymentBlock> discoveryFallback(Throwable t) {
    if (t instanceof DiscoveryException discoveryException) {
      throw discoveryException;
    }
    throw new DiscoveryException("Graphix API unavailable: " + t.getMessage(), t);
  }
}
