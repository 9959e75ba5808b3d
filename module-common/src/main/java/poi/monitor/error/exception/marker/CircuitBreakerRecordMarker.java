package poi.monitor.error.exception.marker;

/**
 * Marks exceptions that count as failures for a circuit breaker.
 *
 * <p>Referenced from the Resilience4j {@code record-exceptions} configuration.
 */
public interface CircuitBreakerRecordMarker {}
