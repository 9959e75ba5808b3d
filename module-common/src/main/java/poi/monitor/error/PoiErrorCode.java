package poi.monitor.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error codes of the POI monitor.
 *
 * <p>Messages are {@link String#format} templates filled from the exception arguments.
 */
@Getter
@AllArgsConstructor
public enum PoiErrorCode implements ErrorCode {
  // === Storage ===
  STORE_READ_FAILURE("S101", "Fingerprint store read failed (%s)"),
  LEDGER_READ_FAILURE("S102", "Notification ledger read failed (%s)"),
  LEDGER_WRITE_FAILURE("S103", "Notification ledger write failed (%s)"),

  // === Collaborators ===
  TRANSPORT_FAILURE("T201", "Notification delivery failed (%s)"),
  DISCOVERY_FAILURE("D301", "Candidate key discovery failed (%s)"),

  // === Engine ===
  INVARIANT_VIOLATION("I401", "Engine invariant violated (%s)"),
  INTERNAL_SERVER_ERROR("I500", "Internal error in task (%s)");

  private final String code;
  private final String message;
}
