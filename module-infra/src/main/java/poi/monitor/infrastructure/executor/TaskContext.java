package poi.monitor.infrastructure.executor;

import java.util.Objects;

/**
 * Structured task name used by {@link LogicExecutor} for logging.
 *
 * <h3>Format</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * TaskContext.of("Ledger", "record", "QmABC@100") → "Ledger:record:QmABC@100"
 * TaskContext.of("Cycle", "purge")                → "Cycle:purge"
 * </pre>
 *
 * <p>{@code component} and {@code operation} are fixed taxonomy values; {@code dynamicValue} holds
 * the key or identifier and is only ever logged.
 *
 * @param component component name, e.g. "Ledger", "Slack", "Graphix"
 * @param operation operation name, e.g. "record", "deliver", "discover"
 * @param dynamicValue per-call value, empty when absent
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /**
   * @return "component:operation:dynamicValue", without the last segment when it is empty
   */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
