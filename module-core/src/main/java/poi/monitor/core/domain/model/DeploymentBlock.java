package poi.monitor.core.domain.model;

import java.util.Objects;

/**
 * Identifies one unit of attested work: a subgraph deployment at a block.
 *
 * <p>Join point across the store, the ledger and the alert message.
 *
 * @param deploymentId IPFS CID of the deployment
 * @param blockNumber block the POIs were computed for
 */
public record DeploymentBlock(String deploymentId, long blockNumber) {

  public DeploymentBlock {
    Objects.requireNonNull(deploymentId, "deploymentId");
    if (deploymentId.isBlank()) {
      throw new IllegalArgumentException("deploymentId must not be blank");
    }
    if (blockNumber < 0) {
      throw new IllegalArgumentException("blockNumber must not be negative, got: " + blockNumber);
    }
  }

  public static DeploymentBlock of(String deploymentId, long blockNumber) {
    return new DeploymentBlock(deploymentId, blockNumber);
  }

  @Override
  public String toString() {
    return deploymentId + "@" + blockNumber;
  }
}
