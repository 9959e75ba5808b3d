package poi.monitor.core.domain.model;

import java.util.Objects;

/**
 * Verdict of the discrepancy detector for one key.
 *
 * <p>{@link Verdict#DISAGREEMENT} carries the full fingerprint set because the alert lists the
 * agents behind every fingerprint, not only the identity.
 *
 * @param key analysed key
 * @param verdict outcome
 * @param fingerprintSet fingerprints observed at analysis time
 * @param identity identity of {@code fingerprintSet}
 */
public record DetectionResult(
    DeploymentBlock key,
    Verdict verdict,
    FingerprintSet fingerprintSet,
    DisagreementIdentity identity) {

  public enum Verdict {
    /** No submissions yet, or every agent submitted the same fingerprint. */
    NO_DISAGREEMENT,
    /** This exact set of fingerprints was already delivered for the key. */
    ALREADY_NOTIFIED,
    /** Two or more distinct fingerprints with no notification on record. */
    DISAGREEMENT
  }

  public DetectionResult {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(verdict, "verdict");
    Objects.requireNonNull(fingerprintSet, "fingerprintSet");
    Objects.requireNonNull(identity, "identity");
  }

  public static DetectionResult noDisagreement(DeploymentBlock key, FingerprintSet fingerprintSet) {
    return new DetectionResult(
        key, Verdict.NO_DISAGREEMENT, fingerprintSet, fingerprintSet.identity());
  }

  public static DetectionResult alreadyNotified(DeploymentBlock key, FingerprintSet fingerprintSet) {
    return new DetectionResult(
        key, Verdict.ALREADY_NOTIFIED, fingerprintSet, fingerprintSet.identity());
  }

  public static DetectionResult disagreement(DeploymentBlock key, FingerprintSet fingerprintSet) {
    return new DetectionResult(key, Verdict.DISAGREEMENT, fingerprintSet, fingerprintSet.identity());
  }
}
