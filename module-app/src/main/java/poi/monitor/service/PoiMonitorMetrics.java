package poi.monitor.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import poi.monitor.core.domain.model.KeyOutcome;

/**
 * Monitoring cycle metrics.
 *
 * <ul>
 *   <li>{@code poi.monitor.keys{outcome}}: processed keys per terminal state
 *   <li>{@code poi.monitor.cycles{result}}: completed, cancelled, invariant_violation,
 *       discovery_failed
 *   <li>{@code poi.monitor.ledger.purged}: ledger records removed by retention
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class PoiMonitorMetrics {

  public static final String CYCLE_COMPLETED = "completed";
  public static final String CYCLE_CANCELLED = "cancelled";
  public static final String CYCLE_INVARIANT_VIOLATION = "invariant_violation";
  public static final String CYCLE_DISCOVERY_FAILED = "discovery_failed";

  private final MeterRegistry registry;

  private final Map<KeyOutcome.Status, Counter> keyCounters =
      new EnumMap<>(KeyOutcome.Status.class);
  private Counter purgedCounter;

  @PostConstruct
  public void init() {
    for (KeyOutcome.Status status : KeyOutcome.Status.values()) {
      keyCounters.put(
          status,
          registry.counter("poi.monitor.keys", "outcome", status.name().toLowerCase(Locale.ROOT)));
    }
    purgedCounter = registry.counter("poi.monitor.ledger.purged");
  }

  public void recordKey(KeyOutcome.Status status) {
    keyCounters.get(status).increment();
  }

  public void recordCycle(String result) {
    registry.counter("poi.monitor.cycles", "result", result).increment();
  }

  public void recordPurged(int count) {
    purgedCounter.increment(count);
  }
}
