package poi.monitor.infrastructure.executor.strategy;

import poi.monitor.error.exception.DiscoveryException;
import poi.monitor.error.exception.InternalSystemException;
import poi.monitor.error.exception.StorageException;
import poi.monitor.error.exception.base.BaseException;
import poi.monitor.infrastructure.executor.TaskContext;
import poi.monitor.infrastructure.util.ExceptionUtils;

/** Translates a technical failure into a domain exception. */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e original failure
   * @param context task that failed
   * @return the translated exception
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Decorator applied by every factory below.
   *
   * <ol>
   *   <li>Error → rethrown as is
   *   <li>CompletionException/ExecutionException → unwrapped to the cause
   *   <li>BaseException → returned as is, it is already a domain exception
   *   <li>anything else → delegated to {@code inner}
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      if (unwrapped instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return inner.translate(unwrapped, context);
    };
  }

  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** Fingerprint store reads. */
  static ExceptionTranslator forStoreRead() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> StorageException.storeRead(context.dynamicValue(), unwrapped));
  }

  static ExceptionTranslator forLedgerRead() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> StorageException.ledgerRead(context.dynamicValue(), unwrapped));
  }

  static ExceptionTranslator forLedgerWrite() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> StorageException.ledgerWrite(context.dynamicValue(), unwrapped));
  }

  /** Graphix API calls: any failure, including a malformed response, is a discovery failure. */
  static ExceptionTranslator forDiscovery() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new DiscoveryException(context.toTaskName() + ": " + unwrapped.getMessage(), unwrapped));
  }
}
