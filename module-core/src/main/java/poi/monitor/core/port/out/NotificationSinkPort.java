package poi.monitor.core.port.out;

/**
 * Delivers a rendered alert to operators.
 *
 * <p>Implementations must not throw for ordinary transport failures.
 */
public interface NotificationSinkPort {

  /**
   * @param message rendered alert text
   * @return true if the message was accepted by the transport
   */
  boolean deliver(String message);
}
