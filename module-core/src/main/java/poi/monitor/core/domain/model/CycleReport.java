package poi.monitor.core.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one monitoring cycle.
 *
 * @param outcomes one entry per processed key, in processing order
 * @param purgeSucceeded whether the ledger retention purge completed
 * @param purgedRecords ledger records removed by the purge, 0 when it failed
 * @param cancelled whether a stop request cut the key loop short
 */
public record CycleReport(
    List<KeyOutcome> outcomes, boolean purgeSucceeded, int purgedRecords, boolean cancelled) {

  public CycleReport {
    Objects.requireNonNull(outcomes, "outcomes");
    outcomes = List.copyOf(outcomes);
  }

  public long count(KeyOutcome.Status status) {
    return outcomes.stream().filter(o -> o.status() == status).count();
  }

  public List<DeploymentBlock> failedKeys() {
    return outcomes.stream().filter(KeyOutcome::isFailed).map(KeyOutcome::key).toList();
  }

  public int processedKeys() {
    return outcomes.size();
  }
}
