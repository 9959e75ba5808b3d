package poi.monitor.core.reuse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import poi.monitor.core.domain.model.Fingerprint;
import poi.monitor.core.domain.model.PoiSubmission;

/**
 * Turns the historical occurrences of fingerprints into provenance lines.
 *
 * <p>For every fingerprint seen more than once, occurrences are sorted most recent first; the
 * first is the current one and every older occurrence becomes one line, annotated with the whole
 * days elapsed until the current one. Fingerprints seen once are omitted.
 *
 * <p>Pure function of its input.
 */
public final class ReuseTrailBuilder {

  /** Most recent first; ties broken by deployment, block and agent so the output is stable. */
  static final Comparator<PoiSubmission> MOST_RECENT_FIRST =
      Comparator.comparing(PoiSubmission::submittedAt)
          .reversed()
          .thenComparing(s -> s.key().deploymentId())
          .thenComparingLong(s -> s.key().blockNumber())
          .thenComparing(PoiSubmission::agentAddress);

  private ReuseTrailBuilder() {}

  /**
   * @param occurrences historical submissions of the fingerprints under analysis
   * @return fingerprint to provenance lines, only for reused fingerprints, in fingerprint order
   */
  public static Map<Fingerprint, List<String>> build(Collection<PoiSubmission> occurrences) {
    Map<Fingerprint, List<PoiSubmission>> byFingerprint =
        occurrences.stream()
            .collect(
                Collectors.groupingBy(PoiSubmission::fingerprint, TreeMap::new, Collectors.toList()));

    Map<Fingerprint, List<String>> trail = new TreeMap<>();
    byFingerprint.forEach(
        (fingerprint, submissions) -> {
          if (submissions.size() > 1) {
            trail.put(fingerprint, provenanceOf(submissions));
          }
        });
    return Collections.unmodifiableMap(trail);
  }

  private static List<String> provenanceOf(List<PoiSubmission> submissions) {
    List<PoiSubmission> sorted = new ArrayList<>(submissions);
    sorted.sort(MOST_RECENT_FIRST);

    PoiSubmission current = sorted.get(0);
    List<String> lines = new ArrayList<>(sorted.size() - 1);
    for (PoiSubmission previous : sorted.subList(1, sorted.size())) {
      long daysAgo = Duration.between(previous.submittedAt(), current.submittedAt()).toDays();
      lines.add(formatLine(daysAgo, previous));
    }
    return List.copyOf(lines);
  }

  static String formatLine(long daysAgo, PoiSubmission previous) {
    return "Previously used "
        + daysAgo
        + " days ago:\n"
        + "• Network: "
        + previous.network()
        + "\n"
        + "• Deployment: "
        + previous.key().deploymentId()
        + "\n"
        + "• Block: "
        + previous.key().blockNumber()
        + "\n"
        + "• Indexer: "
        + previous.agentAddress();
  }
}
