package poi.monitor.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Exception unwrapping utilities. */
public class ExceptionUtils {

  /**
   * Unwraps CompletionException and ExecutionException to the cause they carry.
   *
   * @param throwable the exception to unwrap
   * @return the root cause, or the original if not wrapped
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  private ExceptionUtils() {
    // Utility class
  }
}
