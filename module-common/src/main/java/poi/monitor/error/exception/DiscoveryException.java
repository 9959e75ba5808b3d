package poi.monitor.error.exception;

import poi.monitor.error.PoiErrorCode;
import poi.monitor.error.exception.base.ServerBaseException;
import poi.monitor.error.exception.marker.CircuitBreakerRecordMarker;

/**
 * The candidate key source could not be read.
 *
 * <p>Aborts the cycle before any key is processed and propagates to the scheduler.
 */
public class DiscoveryException extends ServerBaseException implements CircuitBreakerRecordMarker {

  public DiscoveryException(String detail) {
    super(PoiErrorCode.DISCOVERY_FAILURE, detail);
  }

  public DiscoveryException(String detail, Throwable cause) {
    super(PoiErrorCode.DISCOVERY_FAILURE, cause, detail);
  }
}
