package poi.monitor.core.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.DetectionResult;
import poi.monitor.core.domain.model.DetectionResult.Verdict;
import poi.monitor.core.domain.model.DisagreementIdentity;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;
import poi.monitor.core.port.out.FingerprintStorePort;
import poi.monitor.core.port.out.NotificationLedgerPort;
import poi.monitor.error.exception.StorageException;

@ExtendWith(MockitoExtension.class)
@DisplayName("DiscrepancyDetector")
class DiscrepancyDetectorTest {

  private static final DeploymentBlock KEY = DeploymentBlock.of("QmABC", 100);
  private static final Fingerprint H1 = Fingerprint.fromHex("aa01");
  private static final Fingerprint H2 = Fingerprint.fromHex("bb02");

  @Mock private FingerprintStorePort store;
  @Mock private NotificationLedgerPort ledger;

  private DiscrepancyDetector detector;

  @BeforeEach
  void setUp() {
    detector = new DiscrepancyDetector(store, ledger);
  }

  @Nested
  @DisplayName("no disagreement")
  class NoDisagreement {

    @Test
    @DisplayName("no submissions yet")
    void emptySet() {
      given(store.currentSet(KEY)).willReturn(FingerprintSet.empty());

      DetectionResult result = detector.detect(KEY);

      assertThat(result.verdict()).isEqualTo(Verdict.NO_DISAGREEMENT);
      assertThat(result.fingerprintSet().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("every agent agrees on one fingerprint")
    void singleFingerprint() {
      given(store.currentSet(KEY))
          .willReturn(FingerprintSet.builder().add(H1, "a1").add(H1, "a2").add(H1, "a3").build());

      assertThat(detector.detect(KEY).verdict()).isEqualTo(Verdict.NO_DISAGREEMENT);
    }
  }

  @Test
  @DisplayName("two distinct fingerprints without a record are a disagreement carrying the agents")
  void disagreement() {
    FingerprintSet set = FingerprintSet.builder().add(H1, "a1").add(H1, "a2").add(H2, "a3").build();
    given(store.currentSet(KEY)).willReturn(set);

    DetectionResult result = detector.detect(KEY);

    assertThat(result.verdict()).isEqualTo(Verdict.DISAGREEMENT);
    assertThat(result.fingerprintSet()).isEqualTo(set);
    assertThat(result.identity().fingerprints()).containsExactly(H1, H2);
    assertThat(result.fingerprintSet().agentsOf(H1)).containsExactly("a1", "a2");
  }

  @Test
  @DisplayName("a delivered identity is reported as already notified")
  void alreadyNotified() {
    FingerprintSet set = FingerprintSet.builder().add(H2, "a3").add(H1, "a1").build();
    given(store.currentSet(KEY)).willReturn(set);
    given(ledger.hasNotified(KEY, DisagreementIdentity.of(List.of(H1, H2)))).willReturn(true);

    assertThat(detector.detect(KEY).verdict()).isEqualTo(Verdict.ALREADY_NOTIFIED);
  }

  @Test
  @DisplayName("the ledger is consulted with the identity of the current set")
  void ledgerQueriedWithCurrentIdentity() {
    FingerprintSet set = FingerprintSet.builder().add(H2, "a3").add(H1, "a1").build();
    given(store.currentSet(KEY)).willReturn(set);

    detector.detect(KEY);

    verify(ledger).hasNotified(KEY, set.identity());
  }

  @Test
  @DisplayName("store failures propagate to the caller")
  void storeFailurePropagates() {
    given(store.currentSet(any()))
        .willThrow(StorageException.storeRead(KEY.toString(), new RuntimeException("down")));

    assertThatThrownBy(() -> detector.detect(KEY)).isInstanceOf(StorageException.class);
  }
}
