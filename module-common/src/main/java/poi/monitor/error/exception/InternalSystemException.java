package poi.monitor.error.exception;

import poi.monitor.error.PoiErrorCode;
import poi.monitor.error.exception.base.ServerBaseException;

/**
 * Wraps an unmanaged exception escaping a task run through the LogicExecutor.
 *
 * <p>The task name identifies where the failure happened, e.g. {@code PoiMonitor:ProcessKey:QmABC@100}.
 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(PoiErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
