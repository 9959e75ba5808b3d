package poi.monitor.scheduler;

import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import poi.monitor.core.domain.model.CycleReport;
import poi.monitor.error.exception.DiscoveryException;
import poi.monitor.error.exception.InvariantViolationException;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;
import poi.monitor.service.PoiMonitorService;

/**
 * Triggers a monitoring cycle every {@code poi-monitor.check-interval}.
 *
 * <p>Fixed delay in seconds ({@code CHECK_INTERVAL}, default 300): the next cycle starts one
 * interval after the previous one finished. A failed cycle is logged and the next tick retries from
 * scratch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.poi-monitor.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PoiMonitorScheduler {

  private final PoiMonitorService monitorService;
  private final LogicExecutor executor;

  @Scheduled(
      fixedDelayString = "${poi-monitor.check-interval:300}",
      initialDelayString = "${scheduler.poi-monitor.initial-delay:0}",
      timeUnit = TimeUnit.SECONDS)
  public void checkForDiscrepancies() {
    if (monitorService.isStopRequested()) {
      log.debug("[Scheduler] Shutdown in progress, skipping cycle");
      return;
    }
    executor.executeOrCatch(
        () -> monitorService.runScheduledCycle().orElse(null),
        this::onCycleFailure,
        TaskContext.of("Scheduler", "PoiMonitor.Cycle"));
  }

  private CycleReport onCycleFailure(Throwable cause) {
    if (cause instanceof DiscoveryException) {
      log.warn("[Scheduler] Candidate discovery failed, retrying next tick: {}", cause.getMessage());
    } else if (cause instanceof InvariantViolationException) {
      log.error("[Scheduler] Cycle aborted on ledger invariant violation", cause);
    } else {
      log.error("[Scheduler] Cycle failed", cause);
    }
    return null;
  }
}
