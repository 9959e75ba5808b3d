package poi.monitor.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DisagreementIdentity")
class DisagreementIdentityTest {

  private static final Fingerprint H1 = Fingerprint.fromHex("0a01");
  private static final Fingerprint H2 = Fingerprint.fromHex("ff02");
  private static final Fingerprint H3 = Fingerprint.fromHex("7f03");

  @Nested
  @DisplayName("equality")
  class Equality {

    @Test
    @DisplayName("insertion order does not change the identity")
    void orderIndependent() {
      DisagreementIdentity a = DisagreementIdentity.of(List.of(H1, H2, H3));
      DisagreementIdentity b = DisagreementIdentity.of(List.of(H3, H1, H2));

      assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
      assertThat(a.canonicalForm()).isEqualTo(b.canonicalForm());
      assertThat(a.digest()).isEqualTo(b.digest());
    }

    @Test
    @DisplayName("duplicate fingerprints collapse")
    void deduplicates() {
      DisagreementIdentity identity = DisagreementIdentity.of(List.of(H2, H1, H2, H1));

      assertThat(identity.fingerprints()).containsExactly(H1, H2);
    }

    @Test
    @DisplayName("different fingerprint sets differ")
    void differentSets() {
      assertThat(DisagreementIdentity.of(List.of(H1, H2)))
          .isNotEqualTo(DisagreementIdentity.of(List.of(H1, H3)));
      assertThat(DisagreementIdentity.of(List.of(H1, H2)).digest())
          .isNotEqualTo(DisagreementIdentity.of(List.of(H1, H3)).digest());
    }

    @Test
    @DisplayName("fingerprints built from equal bytes are equal")
    void valueEquality() {
      Fingerprint copy = Fingerprint.of(new byte[] {0x0a, 0x01});

      assertThat(DisagreementIdentity.of(List.of(copy))).isEqualTo(DisagreementIdentity.of(List.of(H1)));
    }
  }

  @Test
  @DisplayName("canonical form is unsigned byte order in lowercase hex")
  void canonicalForm() {
    DisagreementIdentity identity = DisagreementIdentity.of(List.of(H2, H3, H1));

    assertThat(identity.canonicalForm()).isEqualTo("0a01,7f03,ff02");
  }

  @Test
  @DisplayName("digest is a 64 character SHA-256 hex string")
  void digestShape() {
    assertThat(DisagreementIdentity.of(List.of(H1)).digest()).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  @DisplayName("empty collection yields the empty identity")
  void empty() {
    assertThat(DisagreementIdentity.of(List.of())).isEqualTo(DisagreementIdentity.empty());
    assertThat(DisagreementIdentity.empty().isEmpty()).isTrue();
    assertThat(DisagreementIdentity.empty().canonicalForm()).isEmpty();
  }
}
