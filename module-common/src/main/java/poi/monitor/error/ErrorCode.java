package poi.monitor.error;

public interface ErrorCode {
  String getCode();

  String getMessage();
}
