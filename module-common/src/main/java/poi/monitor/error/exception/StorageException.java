package poi.monitor.error.exception;

import poi.monitor.error.PoiErrorCode;
import poi.monitor.error.exception.base.ServerBaseException;

/**
 * Read or write failure of the fingerprint store or the notification ledger.
 *
 * <p>Fatal for the key being processed, never for the cycle.
 */
public class StorageException extends ServerBaseException {

  public StorageException(PoiErrorCode errorCode, String detail) {
    super(errorCode, detail);
  }

  public StorageException(PoiErrorCode errorCode, String detail, Throwable cause) {
    super(errorCode, cause, detail);
  }

  public static StorageException storeRead(String detail, Throwable cause) {
    return new StorageException(PoiErrorCode.STORE_READ_FAILURE, detail, cause);
  }

  public static StorageException ledgerRead(String detail, Throwable cause) {
    return new StorageException(PoiErrorCode.LEDGER_READ_FAILURE, detail, cause);
  }

  public static StorageException ledgerWrite(String detail, Throwable cause) {
    return new StorageException(PoiErrorCode.LEDGER_WRITE_FAILURE, detail, cause);
  }
}
