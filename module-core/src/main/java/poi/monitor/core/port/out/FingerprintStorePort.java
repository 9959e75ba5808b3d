package poi.monitor.core.port.out;

import java.util.List;
import java.util.Set;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;
import poi.monitor.core.domain.model.PoiSubmission;

/**
 * Read access to submitted POIs.
 *
 * <p>Implemented in module-infra over the Graphix database. Both operations may fail with {@code
 * StorageException}.
 */
public interface FingerprintStorePort {

  /**
   * Fingerprints currently on record for a key, with the agents that submitted each.
   *
   * @param key deployment and block
   * @return the fingerprint set, empty when nothing was submitted yet
   */
  FingerprintSet currentSet(DeploymentBlock key);

  /**
   * Every historical submission of any of the given fingerprints, across all keys, in one lookup.
   *
   * @param fingerprints fingerprints to look up
   * @return matching submissions in no particular order
   */
  List<PoiSubmission> historicalOccurrences(Set<Fingerprint> fingerprints);
}
