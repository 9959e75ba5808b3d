package poi.monitor.core.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The sorted, de-duplicated sequence of distinct fingerprints observed for a key.
 *
 * <p>Two identities are equal iff they contain the same fingerprint values, whatever agents
 * submitted them and in whatever order the rows were read. This is the dedup key of the
 * notification ledger.
 *
 * <h3>Persisted form</h3>
 *
 * <ul>
 *   <li>{@link #canonicalForm()}: lowercase hex values joined with {@code ','}
 *   <li>{@link #digest()}: SHA-256 of the canonical form, used in the ledger's unique constraint
 * </ul>
 */
public final class DisagreementIdentity {

  private static final String SEPARATOR = ",";
  private static final DisagreementIdentity EMPTY = new DisagreementIdentity(List.of());

  private final List<Fingerprint> fingerprints;

  private DisagreementIdentity(List<Fingerprint> fingerprints) {
    this.fingerprints = fingerprints;
  }

  public static DisagreementIdentity of(Collection<Fingerprint> fingerprints) {
    Objects.requireNonNull(fingerprints, "fingerprints");
    if (fingerprints.isEmpty()) {
      return EMPTY;
    }
    return new DisagreementIdentity(List.copyOf(new TreeSet<>(fingerprints)));
  }

  public static DisagreementIdentity empty() {
    return EMPTY;
  }

  public List<Fingerprint> fingerprints() {
    return fingerprints;
  }

  public int size() {
    return fingerprints.size();
  }

  public boolean isEmpty() {
    return fingerprints.isEmpty();
  }

  public String canonicalForm() {
    return fingerprints.stream().map(Fingerprint::toHex).collect(Collectors.joining(SEPARATOR));
  }

  public String digest() {
    try {
      MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
      byte[] hash = sha256.digest(canonicalForm().getBytes(StandardCharsets.US_ASCII));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DisagreementIdentity other && fingerprints.equals(other.fingerprints);
  }

  @Override
  public int hashCode() {
    return fingerprints.hashCode();
  }

  @Override
  public String toString() {
    return "[" + canonicalForm() + "]";
  }
}
