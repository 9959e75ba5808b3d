package poi.monitor.core.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One historical POI submission. Append-only in the store, never mutated.
 *
 * @param key deployment and block the POI was submitted for
 * @param fingerprint submitted POI
 * @param agentAddress indexer address, lowercase hex
 * @param submittedAt submission time
 * @param network network name of the deployment
 */
public record PoiSubmission(
    DeploymentBlock key,
    Fingerprint fingerprint,
    String agentAddress,
    Instant submittedAt,
    String network) {

  public PoiSubmission {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fingerprint, "fingerprint");
    Objects.requireNonNull(agentAddress, "agentAddress");
    Objects.requireNonNull(submittedAt, "submittedAt");
    Objects.requireNonNull(network, "network");
  }
}
