package poi.monitor.core.detector;

import java.util.Objects;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.DetectionResult;
import poi.monitor.core.domain.model.FingerprintSet;
import poi.monitor.core.port.out.FingerprintStorePort;
import poi.monitor.core.port.out.NotificationLedgerPort;

/**
 * Decides whether the indexers disagree on the POI of a key.
 *
 * <h3>Order of checks</h3>
 *
 * <ol>
 *   <li>Ledger: the current identity was already delivered → {@code ALREADY_NOTIFIED}. Runs before
 *       anything else so known states never reach reuse analysis.
 *   <li>No submissions → {@code NO_DISAGREEMENT}
 *   <li>One distinct fingerprint → {@code NO_DISAGREEMENT}
 *   <li>Otherwise → {@code DISAGREEMENT} with the full fingerprint set
 * </ol>
 *
 * <p>Read-only. Store and ledger failures propagate to the caller.
 */
public class DiscrepancyDetector {

  private final FingerprintStorePort store;
  private final NotificationLedgerPort ledger;

  public DiscrepancyDetector(FingerprintStorePort store, NotificationLedgerPort ledger) {
    this.store = Objects.requireNonNull(store, "store");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
  }

  public DetectionResult detect(DeploymentBlock key) {
    FingerprintSet current = store.currentSet(key);

    if (ledger.hasNotified(key, current.identity())) {
      return DetectionResult.alreadyNotified(key, current);
    }
    if (current.distinctCount() < 2) {
      return DetectionResult.noDisagreement(key, current);
    }
    return DetectionResult.disagreement(key, current);
  }
}
