package poi.monitor.error.exception;

import poi.monitor.error.PoiErrorCode;
import poi.monitor.error.exception.base.ServerBaseException;
import poi.monitor.error.exception.marker.CircuitBreakerRecordMarker;

/**
 * Notification delivery failure.
 *
 * <p>Never escapes the sink: it is logged and turned into an unsuccessful delivery.
 */
public class TransportException extends ServerBaseException implements CircuitBreakerRecordMarker {

  public TransportException(String detail) {
    super(PoiErrorCode.TRANSPORT_FAILURE, detail);
  }

  public TransportException(String detail, Throwable cause) {
    super(PoiErrorCode.TRANSPORT_FAILURE, cause, detail);
  }
}
