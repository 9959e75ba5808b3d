package poi.monitor.infrastructure.executor.policy;

import java.util.Locale;
import java.util.regex.Pattern;
import poi.monitor.infrastructure.executor.TaskContext;

/** Logging helpers for the executor. */
public final class TaskLogSupport {

  private static final String UNKNOWN = "unknown";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TaskLogSupport() {}

  /**
   * Task name safe for a single log line.
   *
   * @return normalized task name, or "unknown" when the context yields nothing usable
   */
  public static String safeTaskName(TaskContext context) {
    if (context == null) return UNKNOWN;

    String name = context.toTaskName();
    if (name == null) return UNKNOWN;

    // control characters and newlines would split the log line
    String normalized = WHITESPACE.matcher(name).replaceAll(" ").trim();
    return normalized.isEmpty() ? UNKNOWN : normalized;
  }

  public static String formatDuration(long elapsedNanos) {
    double millis = elapsedNanos / 1_000_000d;
    return String.format(Locale.ROOT, "%.3fms", millis);
  }
}
