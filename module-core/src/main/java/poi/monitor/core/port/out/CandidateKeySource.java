package poi.monitor.core.port.out;

import java.util.List;
import poi.monitor.core.domain.model.DeploymentBlock;

/** Discovers the deployment/block keys worth checking in a cycle. */
public interface CandidateKeySource {

  /**
   * @return candidate keys, possibly empty, possibly with duplicates
   * @throws poi.monitor.error.exception.DiscoveryException when the source is unreachable
   */
  List<DeploymentBlock> fetchCandidateKeys();
}
