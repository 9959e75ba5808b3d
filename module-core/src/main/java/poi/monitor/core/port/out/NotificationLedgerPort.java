package poi.monitor.core.port.out;

import java.time.Duration;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.DisagreementIdentity;

/**
 * Persistent record of which disagreement identity was already alerted for each key.
 *
 * <p>A record exists for {@code (key, identity)} iff that state was delivered to the sink.
 */
public interface NotificationLedgerPort {

  /** Value-equality test on the identity; insertion order of the fingerprints is irrelevant. */
  boolean hasNotified(DeploymentBlock key, DisagreementIdentity identity);

  /**
   * Atomically records a delivered notification.
   *
   * @throws poi.monitor.error.exception.StorageException when the write fails
   */
  void recordNotified(DeploymentBlock key, DisagreementIdentity identity, String message);

  /**
   * Deletes records older than {@code age}, whether or not the disagreement is still active.
   *
   * @return number of records removed
   */
  int purgeOlderThan(Duration age);
}
