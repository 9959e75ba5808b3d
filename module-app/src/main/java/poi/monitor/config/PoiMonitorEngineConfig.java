package poi.monitor.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import poi.monitor.core.detector.DiscrepancyDetector;
import poi.monitor.core.format.DiscrepancyMessageFormatter;
import poi.monitor.core.port.out.FingerprintStorePort;
import poi.monitor.core.port.out.NotificationLedgerPort;

/** Wires the framework-free engine pieces of module-core into the context. */
@Configuration
public class PoiMonitorEngineConfig {

  @Bean
  public DiscrepancyDetector discrepancyDetector(
      FingerprintStorePort fingerprintStore, NotificationLedgerPort notificationLedger) {
    return new DiscrepancyDetector(fingerprintStore, notificationLedger);
  }

  @Bean
  public DiscrepancyMessageFormatter discrepancyMessageFormatter() {
    return new DiscrepancyMessageFormatter();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
