package poi.monitor.error.exception;

import poi.monitor.error.PoiErrorCode;
import poi.monitor.error.exception.base.ServerBaseException;

/**
 * State the engine relies on is inconsistent, e.g. the ledger matched more than one record for a
 * single disagreement identity.
 *
 * <p>Stops the whole cycle: continuing could notify the same state twice.
 */
public class InvariantViolationException extends ServerBaseException {

  public InvariantViolationException(String detail) {
    super(PoiErrorCode.INVARIANT_VIOLATION, detail);
  }
}
