package poi.monitor.core.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Fingerprint to submitting agents for a single key, derived from the store on demand.
 *
 * <p>Fingerprints iterate in byte-lexicographic order and agents in natural string order, so two
 * sets built from the same rows in any order are equal and iterate identically.
 */
public final class FingerprintSet {

  private static final FingerprintSet EMPTY = new FingerprintSet(new TreeMap<>());

  private final NavigableMap<Fingerprint, SortedSet<String>> agentsByFingerprint;

  private FingerprintSet(NavigableMap<Fingerprint, SortedSet<String>> agentsByFingerprint) {
    this.agentsByFingerprint = agentsByFingerprint;
  }

  public static FingerprintSet empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return agentsByFingerprint.isEmpty();
  }

  public int distinctCount() {
    return agentsByFingerprint.size();
  }

  public SortedSet<Fingerprint> fingerprints() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(agentsByFingerprint.keySet()));
  }

  public SortedSet<String> agentsOf(Fingerprint fingerprint) {
    SortedSet<String> agents = agentsByFingerprint.get(fingerprint);
    return agents == null
        ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(agents);
  }

  /** Read-only view, iterated in fingerprint order. */
  public Map<Fingerprint, SortedSet<String>> asMap() {
    return Collections.unmodifiableMap(agentsByFingerprint);
  }

  public DisagreementIdentity identity() {
    return DisagreementIdentity.of(agentsByFingerprint.keySet());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FingerprintSet other
        && agentsByFingerprint.equals(other.agentsByFingerprint);
  }

  @Override
  public int hashCode() {
    return agentsByFingerprint.hashCode();
  }

  @Override
  public String toString() {
    return agentsByFingerprint.toString();
  }

  public static final class Builder {

    private final NavigableMap<Fingerprint, SortedSet<String>> rows = new TreeMap<>();

    private Builder() {}

    public Builder add(Fingerprint fingerprint, String agent) {
      Objects.requireNonNull(fingerprint, "fingerprint");
      Objects.requireNonNull(agent, "agent");
      rows.computeIfAbsent(fingerprint, f -> new TreeSet<>()).add(agent);
      return this;
    }

    public FingerprintSet build() {
      if (rows.isEmpty()) {
        return EMPTY;
      }
      NavigableMap<Fingerprint, SortedSet<String>> copy = new TreeMap<>();
      rows.forEach((fingerprint, agents) -> copy.put(fingerprint, new TreeSet<>(agents)));
      return new FingerprintSet(copy);
    }
  }
}
