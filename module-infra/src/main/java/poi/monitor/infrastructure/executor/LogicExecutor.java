package poi.monitor.infrastructure.executor;

import java.util.function.Function;
import poi.monitor.infrastructure.executor.function.ThrowingSupplier;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Executes a task under one of the exception handling patterns used across the monitor.
 *
 * <p>Keep business logic in its own method and pass a method reference; the executor owns the
 * try/catch, the translation into domain exceptions and the failure log line.
 *
 * <h3>Patterns</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b>: {@link #executeWithTranslation}
 *   <li><b>try-catch-return</b>: {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b>: {@link #executeOrCatch}, {@link #executeWithFallback}
 * </ol>
 *
 * <pre>{@code
 * public int purge(Duration age) {
 *   return executor.executeWithTranslation(
 *       () -> deleteOlderThan(age), ExceptionTranslator.forLedgerWrite(), TaskContext.of("Ledger", "purge"));
 * }
 * }</pre>
 *
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /** Runs the task, returning {@code defaultValue} on any failure. Errors still propagate. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * Runs the task; on failure, passes the translated exception to {@code recovery} and returns its
   * value.
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /**
   * Runs the task, translating any failure with {@code translator} and rethrowing it.
   *
   * @throws RuntimeException the translated failure
   */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  /**
   * Runs the task; on failure, passes the original (untranslated) exception to {@code fallback}.
   */
  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);
}
