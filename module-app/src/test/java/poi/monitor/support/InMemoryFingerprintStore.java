package poi.monitor.support;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;
import poi.monitor.core.domain.model.PoiSubmission;
import poi.monitor.core.port.out.FingerprintStorePort;
import poi.monitor.error.exception.StorageException;

/** Fingerprint store backed by a list of submissions, with per-key failure injection. */
public class InMemoryFingerprintStore implements FingerprintStorePort {

  private final List<PoiSubmission> submissions = new ArrayList<>();
  private final Map<DeploymentBlock, RuntimeException> readFailures = new HashMap<>();
  private RuntimeException historyFailure;

  public InMemoryFingerprintStore add(PoiSubmission submission) {
    submissions.add(submission);
    return this;
  }

  /** Drops every submission for {@code key}, as if the indexers re-submitted from scratch. */
  public void clear(DeploymentBlock key) {
    submissions.removeIf(s -> s.key().equals(key));
  }

  public void failReadsFor(DeploymentBlock key) {
    readFailures.put(key, StorageException.storeRead(key.toString(), null));
  }

  public void failHistory(RuntimeException failure) {
    historyFailure = failure;
  }

  @Override
  public FingerprintSet currentSet(DeploymentBlock key) {
    RuntimeException failure = readFailures.get(key);
    if (failure != null) {
      throw failure;
    }
    FingerprintSet.Builder builder = FingerprintSet.builder();
    submissions.stream()
        .filter(s -> s.key().equals(key))
        .forEach(s -> builder.add(s.fingerprint(), s.agentAddress()));
    return builder.build();
  }

  @Override
  public List<PoiSubmission> historicalOccurrences(Set<Fingerprint> fingerprints) {
    if (historyFailure != null) {
      throw historyFailure;
    }
    return submissions.stream().filter(s -> fingerprints.contains(s.fingerprint())).toList();
  }
}
