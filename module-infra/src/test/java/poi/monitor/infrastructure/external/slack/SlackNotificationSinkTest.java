package poi.monitor.infrastructure.external.slack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.net.ConnectException;
import java.net.URI;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import poi.monitor.infrastructure.config.PoiMonitorProperties;
import poi.monitor.infrastructure.executor.DefaultLogicExecutor;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;
import poi.monitor.infrastructure.support.WebClientMockHelper;

@DisplayName("SlackNotificationSink")
class SlackNotificationSinkTest {

  private static final String WEBHOOK = "https://hooks.slack.test/services/T000/B000/XXX";

  private final LogicExecutor executor =
      new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator(), 0);

  private PoiMonitorProperties properties;

  @BeforeEach
  void setUp() {
    properties = new PoiMonitorProperties();
    properties.getSlack().setWebhookUrl(WEBHOOK);
  }

  @Test
  @DisplayName("a 2xx response is a successful delivery")
  void delivered() {
    WebClient webClient = WebClientMockHelper.webClientWithStatus(200);
    SlackNotificationSink sink = new SlackNotificationSink(webClient, executor, properties);

    assertThat(sink.deliver("alert")).isTrue();
  }

  @Test
  @DisplayName("posts the message as the text field to the webhook")
  void payload() {
    WebClient webClient = WebClientMockHelper.webClientWithStatus(200);
    SlackNotificationSink sink = new SlackNotificationSink(webClient, executor, properties);

    sink.deliver("alert");

    WebClient.RequestBodyUriSpec uriSpec = webClient.post();
    WebClient.RequestBodySpec bodySpec = uriSpec.uri(WEBHOOK);
    verify(uriSpec, atLeastOnce()).uri(WEBHOOK);
    verify(bodySpec).bodyValue(Map.of("text", "alert"));
  }

  @Test
  @DisplayName("a non-2xx status is a failed delivery")
  void rejected() {
    WebClient webClient = WebClientMockHelper.webClientWithStatus(302);
    SlackNotificationSink sink = new SlackNotificationSink(webClient, executor, properties);

    assertThat(sink.deliver("alert")).isFalse();
  }

  @Test
  @DisplayName("an error status raised by retrieve is a failed delivery, never an exception")
  void errorStatus() {
    WebClient webClient = WebClientMockHelper.webClientThatThrows(500, "Internal Server Error");
    SlackNotificationSink sink = new SlackNotificationSink(webClient, executor, properties);

    assertThat(sink.deliver("alert")).isFalse();
  }

  @Test
  @DisplayName("a rejected delivery is logged once at WARN without a stack trace")
  void rejectionLoggedOnce() {
    WebClient webClient = WebClientMockHelper.webClientWithStatus(302);
    SlackNotificationSink sink = new SlackNotificationSink(webClient, executor, properties);
    Logger logger = (Logger) LoggerFactory.getLogger(SlackNotificationSink.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    try {
      sink.deliver("alert");
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertThat(appender.list)
        .singleElement()
        .satisfies(
            event -> {
              assertThat(event.getLevel()).isEqualTo(Level.WARN);
              assertThat(event.getFormattedMessage())
                  .isEqualTo("[SlackSink] Delivery failed: webhook answered 302 FOUND");
              assertThat(event.getThrowableProxy()).isNull();
            });
  }

  @Test
  @DisplayName("a connection failure is a failed delivery")
  void connectionFailure() {
    WebClient webClient =
        WebClientMockHelper.webClientThatFails(
            new WebClientRequestException(
                new ConnectException("refused"),
                HttpMethod.POST,
                URI.create(WEBHOOK),
                new HttpHeaders()));
    SlackNotificationSink sink = new SlackNotificationSink(webClient, executor, properties);

    assertThat(sink.deliver("alert")).isFalse();
  }
}
