package poi.monitor.infrastructure.external.slack;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import poi.monitor.core.port.out.NotificationSinkPort;
import poi.monitor.error.exception.TransportException;
import poi.monitor.infrastructure.config.PoiMonitorProperties;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;

/**
 * Delivers alerts to a Slack incoming webhook as {@code {"text": message}}.
 *
 * <p>Never throws for transport problems: timeouts, connection failures and non-2xx responses
 * ({@link TransportException}) are logged once and reported as an unsuccessful delivery, so the
 * caller leaves the ledger untouched and retries on the next cycle.
 */
@Slf4j
@Component
public class SlackNotificationSink implements NotificationSinkPort {

  private final WebClient slackWebClient;
  private final LogicExecutor executor;
  private final PoiMonitorProperties properties;

  public SlackNotificationSink(
      @Qualifier("slackWebClient") WebClient slackWebClient,
      LogicExecutor executor,
      PoiMonitorProperties properties) {
    this.slackWebClient = slackWebClient;
    this.executor = executor;
    this.properties = properties;
  }

  @Override
  public boolean deliver(String message) {
    return executor.executeWithFallback(
        () -> post(message), this::handleFailure, TaskContext.of("SlackSink", "deliver"));
  }

  private boolean post(String message) {
    PoiMonitorProperties.Slack slack = properties.getSlack();
    ResponseEntity<Void> response =
        slackWebClient
            .post()
            .uri(slack.getWebhookUrl())
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .block(slack.getTimeout());

    if (response == null) {
      throw new TransportException("no response from webhook");
    }
    if (!response.getStatusCode().is2xxSuccessful()) {
      throw new TransportException("webhook answered " + response.getStatusCode());
    }
    log.info("[SlackSink] Notification sent: {}", response.getStatusCode());
    return true;
  }

  private boolean handleFailure(Throwable e) {
    if (e instanceof TransportException
        || e instanceof WebClientRequestException
        || e instanceof WebClientResponseException) {
      log.warn("[SlackSink] Delivery failed: {}", e.getMessage());
    } else {
      log.error("[SlackSink] Unexpected error sending notification", e);
    }
    return false;
  }
}
