package poi.monitor.core.domain.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A proof-of-indexing value submitted by one indexer.
 *
 * <p>Opaque bytes compared by value. The natural order is unsigned byte-lexicographic, which is the
 * canonical order of a {@link DisagreementIdentity}; it carries no other meaning.
 */
public final class Fingerprint implements Comparable<Fingerprint> {

  private static final HexFormat HEX = HexFormat.of();

  private final byte[] bytes;

  private Fingerprint(byte[] bytes) {
    this.bytes = bytes;
  }

  public static Fingerprint of(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length == 0) {
      throw new IllegalArgumentException("fingerprint must not be empty");
    }
    return new Fingerprint(bytes.clone());
  }

  /** Parses lowercase or uppercase hex, with or without a {@code 0x} prefix. */
  public static Fingerprint fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    return of(HEX.parseHex(digits));
  }

  public byte[] toBytes() {
    return bytes.clone();
  }

  /** Lowercase hex without prefix. */
  public String toHex() {
    return HEX.formatHex(bytes);
  }

  @Override
  public int compareTo(Fingerprint other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Fingerprint other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
