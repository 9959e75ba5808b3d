package poi.monitor.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Dedicated WebClients for the Slack webhook and the Graphix API.
 *
 * <p>Separate connection pools so a hanging Graphix API never delays alert delivery. Every request
 * is bounded by the configured timeout on connect, response, read and write.
 */
@Configuration
@RequiredArgsConstructor
public class PoiMonitorWebClientConfig {

  private final PoiMonitorProperties properties;

  @Bean("slackWebClient")
  public WebClient slackWebClient() {
    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient(properties.getSlack().getTimeout())))
        .build();
  }

  @Bean("graphixWebClient")
  public WebClient graphixWebClient() {
    return WebClient.builder()
        .clientConnector(
            new ReactorClientHttpConnector(httpClient(properties.getGraphix().getTimeout())))
        .build();
  }

  static HttpClient httpClient(Duration timeout) {
    long millis = timeout.toMillis();
    return HttpClient.create()
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(millis, Integer.MAX_VALUE))
        .responseTimeout(timeout)
        .doOnConnected(
            conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(millis, TimeUnit.MILLISECONDS))
                    .addHandlerLast(new WriteTimeoutHandler(millis, TimeUnit.MILLISECONDS)));
  }
}
