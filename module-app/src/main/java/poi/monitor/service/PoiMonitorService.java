package poi.monitor.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import poi.monitor.core.detector.DiscrepancyDetector;
import poi.monitor.core.domain.model.CycleReport;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.DetectionResult;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.KeyOutcome;
import poi.monitor.core.domain.model.KeyOutcome.Status;
import poi.monitor.core.format.DiscrepancyMessageFormatter;
import poi.monitor.core.port.out.CandidateKeySource;
import poi.monitor.core.port.out.NotificationLedgerPort;
import poi.monitor.core.port.out.NotificationSinkPort;
import poi.monitor.error.exception.DiscoveryException;
import poi.monitor.error.exception.InvariantViolationException;
import poi.monitor.infrastructure.config.PoiMonitorProperties;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;

/**
 * Runs one monitoring cycle over a batch of candidate keys.
 *
 * <h3>Per key</h3>
 *
 * <pre>
 * detect → (disagreement) reuse → format → deliver → record
 * </pre>
 *
 * <ul>
 *   <li>Keys are processed sequentially; a failing key becomes a {@code FAILED} outcome and the
 *       batch continues
 *   <li>A refused delivery is never recorded, so the same state is retried next cycle
 *   <li>{@link InvariantViolationException} stops the cycle at once, without purge
 *   <li>Retention purge runs exactly once after the key loop, also when the loop was cancelled
 * </ul>
 *
 * <h3>Concurrency</h3>
 *
 * <p>Cycles never overlap: a cycle that cannot take the guard is skipped. {@link #requestStop()}
 * lets the in-flight key finish and stops before the next one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoiMonitorService {

  private static final int PURGE_FAILED = -1;

  private final CandidateKeySource candidateKeySource;
  private final DiscrepancyDetector detector;
  private final PoiReuseAnalyzer reuseAnalyzer;
  private final DiscrepancyMessageFormatter formatter;
  private final NotificationSinkPort notificationSink;
  private final NotificationLedgerPort notificationLedger;
  private final LogicExecutor executor;
  private final PoiMonitorMetrics metrics;
  private final PoiMonitorProperties properties;

  private final ReentrantLock cycleGuard = new ReentrantLock();
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);

  /**
   * Discovers candidate keys and runs a cycle over them.
   *
   * @return the cycle report, empty when another cycle was still running
   * @throws DiscoveryException when the candidate keys cannot be fetched; no key is processed
   */
  public Optional<CycleReport> runScheduledCycle() {
    if (!cycleGuard.tryLock()) {
      log.warn("[PoiMonitor] Previous cycle still running, skipping");
      return Optional.empty();
    }
    try {
      return runCycle(discoverKeys());
    } finally {
      cycleGuard.unlock();
    }
  }

  /**
   * Runs a cycle over the given keys, de-duplicated in first-seen order.
   *
   * @return the cycle report, empty when another cycle was still running
   * @throws InvariantViolationException when the ledger is inconsistent
   */
  public Optional<CycleReport> runCycle(List<DeploymentBlock> candidateKeys) {
    if (!cycleGuard.tryLock()) {
      log.warn("[PoiMonitor] Previous cycle still running, skipping");
      return Optional.empty();
    }
    try {
      return Optional.of(processBatch(new LinkedHashSet<>(candidateKeys)));
    } finally {
      cycleGuard.unlock();
    }
  }

  /** Cooperative cancellation; the current key finishes, later keys are left for no one. */
  public void requestStop() {
    if (stopRequested.compareAndSet(false, true)) {
      log.info("[PoiMonitor] Stop requested");
    }
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  private List<DeploymentBlock> discoverKeys() {
    try {
      return candidateKeySource.fetchCandidateKeys();
    } catch (DiscoveryException e) {
      metrics.recordCycle(PoiMonitorMetrics.CYCLE_DISCOVERY_FAILED);
      throw e;
    }
  }

  private CycleReport processBatch(LinkedHashSet<DeploymentBlock> keys) {
    log.info("[PoiMonitor] Cycle started: {} candidate keys", keys.size());
    List<KeyOutcome> outcomes = new ArrayList<>(keys.size());
    boolean cancelled = false;

    for (DeploymentBlock key : keys) {
      if (stopRequested.get()) {
        cancelled = true;
        log.warn(
            "[PoiMonitor] Stopping before {}: {} of {} keys processed",
            key,
            outcomes.size(),
            keys.size());
        break;
      }
      KeyOutcome outcome = processKeyIsolated(key);
      metrics.recordKey(outcome.status());
      outcomes.add(outcome);
    }

    int purged =
        executor.executeOrDefault(
            () -> notificationLedger.purgeOlderThan(properties.getRetention()),
            PURGE_FAILED,
            TaskContext.of("PoiMonitor", "purge"));
    boolean purgeSucceeded = purged != PURGE_FAILED;
    if (purgeSucceeded) {
      metrics.recordPurged(purged);
    } else {
      log.error("[PoiMonitor] Ledger retention purge failed, retrying next cycle");
    }

    CycleReport report =
        new CycleReport(outcomes, purgeSucceeded, purgeSucceeded ? purged : 0, cancelled);
    metrics.recordCycle(
        cancelled ? PoiMonitorMetrics.CYCLE_CANCELLED : PoiMonitorMetrics.CYCLE_COMPLETED);
    logSummary(report);
    return report;
  }

  private KeyOutcome processKeyIsolated(DeploymentBlock key) {
    return executor.executeOrCatch(
        () -> processKey(key),
        e -> onKeyFailure(key, e),
        TaskContext.of("PoiMonitor", "processKey", key.toString()));
  }

  private KeyOutcome processKey(DeploymentBlock key) {
    DetectionResult detection = detector.detect(key);

    switch (detection.verdict()) {
      case NO_DISAGREEMENT:
        log.debug("[PoiMonitor] No disagreement for {}", key);
        return KeyOutcome.of(key, Status.NO_DISAGREEMENT);
      case ALREADY_NOTIFIED:
        log.debug("[PoiMonitor] Disagreement for {} already notified", key);
        return KeyOutcome.of(key, Status.ALREADY_NOTIFIED);
      default:
        return notifyDisagreement(detection);
    }
  }

  private KeyOutcome notifyDisagreement(DetectionResult detection) {
    DeploymentBlock key = detection.key();
    log.info(
        "[PoiMonitor] Disagreement for {}: {} distinct POIs",
        key,
        detection.fingerprintSet().distinctCount());

    Map<Fingerprint, List<String>> reuse = reuseAnalyzer.analyze(key, detection.fingerprintSet());
    String message = formatter.format(key, detection.fingerprintSet(), reuse);

    if (!notificationSink.deliver(message)) {
      log.warn("[PoiMonitor] Delivery failed for {}, retrying next cycle", key);
      return KeyOutcome.of(key, Status.DELIVERY_FAILED);
    }
    notificationLedger.recordNotified(key, detection.identity(), message);
    log.info("[PoiMonitor] Notified disagreement for {}", key);
    return KeyOutcome.of(key, Status.NOTIFIED);
  }

  private KeyOutcome onKeyFailure(DeploymentBlock key, Throwable cause) {
    if (cause instanceof InvariantViolationException violation) {
      log.error("[PoiMonitor] Invariant violated at {}, stopping cycle", key, violation);
      metrics.recordCycle(PoiMonitorMetrics.CYCLE_INVARIANT_VIOLATION);
      throw violation;
    }
    // stack trace already logged by the failing task
    log.error("[PoiMonitor] Processing failed for {}: {}", key, cause.getMessage());
    return KeyOutcome.failed(key, cause);
  }

  private static void logSummary(CycleReport report) {
    log.info(
        "[PoiMonitor] Cycle finished: keys={}, notified={}, alreadyNotified={}, deliveryFailed={},"
            + " failed={}, purged={}, purgeSucceeded={}, cancelled={}",
        report.processedKeys(),
        report.count(Status.NOTIFIED),
        report.count(Status.ALREADY_NOTIFIED),
        report.count(Status.DELIVERY_FAILED),
        report.count(Status.FAILED),
        report.purgedRecords(),
        report.purgeSucceeded(),
        report.cancelled());
  }
}
