package poi.monitor.error.exception.base;

import poi.monitor.error.ErrorCode;

/**
 * Base of every failure raised by the monitor itself or by one of its collaborators.
 *
 * <p>Carries the key or resource name in the message so a failed task can be traced from the log
 * line alone.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
