package poi.monitor.infrastructure.executor.function;

/** {@link java.util.function.Supplier} that may throw checked exceptions. */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
