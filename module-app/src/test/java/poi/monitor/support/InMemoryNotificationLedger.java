package poi.monitor.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.DisagreementIdentity;
import poi.monitor.core.port.out.NotificationLedgerPort;
import poi.monitor.error.exception.InvariantViolationException;
import poi.monitor.error.exception.StorageException;

/** Ledger kept in a list, with failure injection for reads, writes and the purge. */
public class InMemoryNotificationLedger implements NotificationLedgerPort {

  public record Entry(DeploymentBlock key, DisagreementIdentity identity, String message) {}

  private final List<Entry> entries = new ArrayList<>();
  private boolean failWrites;
  private boolean failPurge;
  private DeploymentBlock ambiguousKey;
  private int purgeCalls;
  private int purgeResult;

  public List<Entry> entries() {
    return List.copyOf(entries);
  }

  public int purgeCalls() {
    return purgeCalls;
  }

  public void failWrites() {
    failWrites = true;
  }

  public void failPurge() {
    failPurge = true;
  }

  public void purgeReturns(int removed) {
    purgeResult = removed;
  }

  /** Reads for this key report more than one matching record. */
  public void ambiguousFor(DeploymentBlock key) {
    ambiguousKey = key;
  }

  @Override
  public boolean hasNotified(DeploymentBlock key, DisagreementIdentity identity) {
    if (key.equals(ambiguousKey)) {
      throw new InvariantViolationException("2 ledger records for " + key);
    }
    return entries.stream().anyMatch(e -> e.key().equals(key) && e.identity().equals(identity));
  }

  @Override
  public void recordNotified(DeploymentBlock key, DisagreementIdentity identity, String message) {
    if (failWrites) {
      throw StorageException.ledgerWrite(key.toString(), null);
    }
    entries.add(new Entry(key, identity, message));
  }

  @Override
  public int purgeOlderThan(Duration age) {
    purgeCalls++;
    if (failPurge) {
      throw StorageException.ledgerWrite("purge", null);
    }
    return purgeResult;
  }
}
