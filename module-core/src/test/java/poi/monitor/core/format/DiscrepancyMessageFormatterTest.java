package poi.monitor.core.format;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;

@DisplayName("DiscrepancyMessageFormatter")
class DiscrepancyMessageFormatterTest {

  private static final DeploymentBlock KEY = DeploymentBlock.of("QmABC", 100);
  private static final Fingerprint H1 = Fingerprint.fromHex("0A0B");
  private static final Fingerprint H2 = Fingerprint.fromHex("FF00");

  private final DiscrepancyMessageFormatter formatter = new DiscrepancyMessageFormatter();

  @Test
  @DisplayName("renders header, hashes in hex and sorted agents")
  void rendersMessage() {
    FingerprintSet set =
        FingerprintSet.builder().add(H2, "c3").add(H1, "b2").add(H1, "a1").build();

    String message = formatter.format(KEY, set, Map.of());

    assertThat(message)
        .isEqualTo(
            String.join(
                "\n",
                "🚨 *New POI Discrepancy Found*",
                "*Deployment:* `QmABC`",
                "*Block:* `100`",
                "*POI Submissions:*",
                "*POI Hash:* `0a0b`",
                "*Submitted by:* `a1, b2`",
                "",
                "*POI Hash:* `ff00`",
                "*Submitted by:* `c3`",
                ""));
  }

  @Test
  @DisplayName("reuse lines are listed under the fingerprint they belong to")
  void rendersReuse() {
    FingerprintSet set = FingerprintSet.builder().add(H1, "a1").add(H2, "a2").build();
    Map<Fingerprint, List<String>> reuse = Map.of(H2, List.of("Previously used 2 days ago:"));

    String message = formatter.format(KEY, set, reuse);

    assertThat(message)
        .contains(
            "*POI Hash:* `ff00`\n"
                + "⚠️ *POI Reuse:*\n"
                + "  • Previously used 2 days ago:\n"
                + "*Submitted by:* `a2`");
    assertThat(message).containsOnlyOnce("POI Reuse");
  }

  @Test
  @DisplayName("the same logical data always renders byte-identical text")
  void orderIndependent() {
    FingerprintSet a =
        FingerprintSet.builder().add(H1, "a1").add(H1, "a2").add(H2, "a3").build();
    FingerprintSet b =
        FingerprintSet.builder().add(H2, "a3").add(H1, "a2").add(H1, "a1").build();

    assertThat(formatter.format(KEY, a, Map.of())).isEqualTo(formatter.format(KEY, b, Map.of()));
  }
}
