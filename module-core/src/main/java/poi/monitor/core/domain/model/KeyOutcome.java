package poi.monitor.core.domain.model;

import java.util.Objects;

/**
 * Result of processing one key in a cycle.
 *
 * <p>Failures are values here, not exceptions: a failed key never aborts the rest of the batch.
 *
 * @param key processed key
 * @param status terminal state
 * @param cause failure cause, only for {@link Status#FAILED}
 */
public record KeyOutcome(DeploymentBlock key, Status status, Throwable cause) {

  public enum Status {
    NO_DISAGREEMENT,
    ALREADY_NOTIFIED,
    NOTIFIED,
    /** The sink refused the message; nothing was recorded so the next cycle retries. */
    DELIVERY_FAILED,
    FAILED
  }

  public KeyOutcome {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
    if (status == Status.FAILED && cause == null) {
      throw new IllegalArgumentException("FAILED outcome requires a cause");
    }
  }

  public static KeyOutcome of(DeploymentBlock key, Status status) {
    return new KeyOutcome(key, status, null);
  }

  public static KeyOutcome failed(DeploymentBlock key, Throwable cause) {
    return new KeyOutcome(key, Status.FAILED, cause);
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}
