package poi.monitor.core.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import poi.monitor.core.domain.model.DeploymentBlock;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.FingerprintSet;

/**
 * Renders a disagreement as a Slack mrkdwn message.
 *
 * <p>Fingerprints are listed in byte-lexicographic order and agents in sorted order, so the same
 * logical data always renders to the same text. Operators compare alerts by this text.
 *
 * <pre>
 * 🚨 *New POI Discrepancy Found*
 * *Deployment:* `QmABC`
 * *Block:* `100`
 * *POI Submissions:*
 * *POI Hash:* `0a1b...`
 * ⚠️ *POI Reuse:*
 *   • Previously used 3 days ago: ...
 * *Submitted by:* `a1, a2`
 * </pre>
 */
public class DiscrepancyMessageFormatter {

  static final String HEADER = "🚨 *New POI Discrepancy Found*";
  static final String REUSE_HEADER = "⚠️ *POI Reuse:*";

  public String format(
      DeploymentBlock key, FingerprintSet fingerprintSet, Map<Fingerprint, List<String>> reuse) {
    List<String> lines = new ArrayList<>();
    lines.add(HEADER);
    lines.add("*Deployment:* `" + key.deploymentId() + "`");
    lines.add("*Block:* `" + key.blockNumber() + "`");
    lines.add("*POI Submissions:*");

    for (Map.Entry<Fingerprint, SortedSet<String>> entry : fingerprintSet.asMap().entrySet()) {
      Fingerprint fingerprint = entry.getKey();
      lines.add("*POI Hash:* `" + fingerprint.toHex() + "`");

      List<String> trail = reuse.getOrDefault(fingerprint, List.of());
      if (!trail.isEmpty()) {
        lines.add(REUSE_HEADER);
        trail.forEach(detail -> lines.add("  • " + detail));
      }

      lines.add("*Submitted by:* `" + String.join(", ", entry.getValue()) + "`");
      lines.add("");
    }
    return String.join("\n", lines);
  }
}
