package poi.monitor.infrastructure.executor;

import static poi.monitor.infrastructure.executor.policy.TaskLogTags.TAG_FAILURE;
import static poi.monitor.infrastructure.executor.policy.TaskLogTags.TAG_RECOVERED;
import static poi.monitor.infrastructure.executor.policy.TaskLogTags.TAG_SLOW;
import static poi.monitor.infrastructure.executor.policy.TaskLogTags.TAG_SUCCESS;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import poi.monitor.infrastructure.executor.function.ThrowingSupplier;
import poi.monitor.infrastructure.executor.policy.TaskLogSupport;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * {@link LogicExecutor} that times every task and logs its outcome.
 *
 * <ul>
 *   <li>success: {@code [Task:SUCCESS]} at DEBUG, {@code [Task:SLOW]} at INFO past the threshold
 *   <li>rethrown failure: {@code [Task:FAILURE]} at ERROR with the stack trace
 *   <li>recovered failure: {@code [Task:RECOVERED]} at WARN, without the stack trace
 *   <li>{@link Error}: rethrown untouched, never translated
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;
  private final long slowThresholdNanos;

  /**
   * @param translator translator handed to {@link #executeOrCatch} recoveries
   * @param slowMs tasks at or above this duration are logged as slow; 0 or less disables it
   */
  public DefaultLogicExecutor(ExceptionTranslator translator, long slowMs) {
    this.translator = Objects.requireNonNull(translator, "translator");
    this.slowThresholdNanos =
        slowMs > 0 ? TimeUnit.MILLISECONDS.toNanos(slowMs) : Long.MAX_VALUE;
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    return run(task, context, t -> recovery.apply(translateSafe(translator, t, context)));
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      logSuccess(System.nanoTime() - start, context);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable primary = translateSafe(customTranslator, t, context);
      log.error(
          "{} {}, elapsed={}, errorType={}",
          TAG_FAILURE,
          TaskLogSupport.safeTaskName(context),
          TaskLogSupport.formatDuration(System.nanoTime() - start),
          primary.getClass().getSimpleName(),
          primary);
      throwAsUnchecked(primary);
      return unreachable();
    }
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(fallback, "fallback");
    return run(task, context, fallback);
  }

  private <T> T run(
      ThrowingSupplier<T> task, TaskContext context, Function<Throwable, T> onFailure) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      logSuccess(System.nanoTime() - start, context);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      log.warn(
          "{} {}, elapsed={}, errorType={}, message={}",
          TAG_RECOVERED,
          TaskLogSupport.safeTaskName(context),
          TaskLogSupport.formatDuration(System.nanoTime() - start),
          t.getClass().getSimpleName(),
          t.getMessage());
      return onFailure.apply(t);
    }
  }

  private void logSuccess(long elapsedNanos, TaskContext context) {
    if (elapsedNanos >= slowThresholdNanos) {
      log.info(
          "{} {}, elapsed={}",
          TAG_SLOW,
          TaskLogSupport.safeTaskName(context),
          TaskLogSupport.formatDuration(elapsedNanos));
      return;
    }
    if (!log.isDebugEnabled()) return;
    log.debug(
        "{} {}, elapsed={}",
        TAG_SUCCESS,
        TaskLogSupport.safeTaskName(context),
        TaskLogSupport.formatDuration(elapsedNanos));
  }

  private static Throwable translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static void throwAsUnchecked(Throwable t) {
    if (t instanceof Error e) throw e;
    if (t instanceof RuntimeException re) throw re;
    throw new IllegalStateException("Unexpected checked throwable", t);
  }

  private static <T> T unreachable() {
    return null;
  }
}
