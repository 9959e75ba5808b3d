package poi.monitor.service;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;
import poi.monitor.core.port.out.FingerprintStorePort;
import poi.monitor.core.reuse.ReuseTrailBuilder;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.TaskContext;

/**
 * Finds earlier submissions of the fingerprints in a disagreement.
 *
 * <p>One batched store lookup per disagreement. Best effort: a failed lookup is logged and yields
 * an empty map, so the alert still goes out without reuse annotations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoiReuseAnalyzer {

  private final FingerprintStorePort fingerprintStore;
  private final LogicExecutor executor;

  public Map<Fingerprint, List<String>> analyze(DeploymentBlock key, FingerprintSet fingerprintSet) {
    if (fingerprintSet.isEmpty()) {
      return Map.of();
    }
    return executor.executeOrDefault(
        () -> buildTrail(fingerprintSet),
        Map.of(),
        TaskContext.of("ReuseAnalyzer", "analyze", key.toString()));
  }

  private Map<Fingerprint, List<String>> buildTrail(FingerprintSet fingerprintSet) {
    Map<Fingerprint, List<String>> trail =
        ReuseTrailBuilder.build(fingerprintStore.historicalOccurrences(fingerprintSet.fingerprints()));
    if (!trail.isEmpty()) {
      log.info("[ReuseAnalyzer] {} reused fingerprints", trail.size());
    }
    return trail;
  }
}
