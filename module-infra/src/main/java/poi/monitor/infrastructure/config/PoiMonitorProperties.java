package poi.monitor.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * POI monitor settings.
 *
 * <pre>{@code
 * poi-monitor:
 *   check-interval: 300
 *   retention: P60D
 *   slack:
 *     webhook-url: ${SLACK_WEBHOOK_URL}
 *   graphix:
 *     url: ${GRAPHIX_API_URL:http://localhost:8000/graphql}
 * }</pre>
 *
 * <p>Startup fails when the Slack webhook URL is missing.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "poi-monitor")
public class PoiMonitorProperties {

  /** Delay between the end of a cycle and the start of the next one; bare numbers are seconds. */
  @DurationUnit(ChronoUnit.SECONDS)
  @NotNull
  private Duration checkInterval = Duration.ofMinutes(5);

  /** Ledger records older than this are purged at the end of every cycle. */
  @NotNull private Duration retention = Duration.ofDays(60);

  /** Tasks at or above this duration are logged as slow. */
  @NotNull private Duration slowTaskThreshold = Duration.ofSeconds(1);

  @Valid @NotNull private Slack slack = new Slack();

  @Valid @NotNull private Graphix graphix = new Graphix();

  @Data
  public static class Slack {

    @NotBlank private String webhookUrl;

    @NotNull private Duration timeout = Duration.ofSeconds(10);
  }

  @Data
  public static class Graphix {

    @NotBlank private String url = "http://localhost:8000/graphql";

    /** {@code limit} argument of the indexers query; the server accepts at most 250. */
    @Min(1)
    @Max(250)
    private int pageSize = 100;

    @NotNull private Duration timeout = Duration.ofSeconds(10);
  }
}
