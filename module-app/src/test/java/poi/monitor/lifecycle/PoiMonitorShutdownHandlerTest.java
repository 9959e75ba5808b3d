package poi.monitor.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import poi.monitor.service.PoiMonitorService;

@Tag("unit")
class PoiMonitorShutdownHandlerTest {

  private final PoiMonitorService monitorService = mock(PoiMonitorService.class);
  private final PoiMonitorShutdownHandler handler = new PoiMonitorShutdownHandler(monitorService);

  @Test
  @DisplayName("stop asks the running cycle to stop")
  void stopRequestsCycleStop() {
    // given
    handler.start();

    // when
    handler.stop();

    // then
    verify(monitorService).requestStop();
    assertThat(handler.isRunning()).isFalse();
  }

  @Test
  @DisplayName("stops before any other lifecycle bean")
  void highestPhase() {
    assertThat(handler.getPhase()).isEqualTo(Integer.MAX_VALUE);
    assertThat(handler.isAutoStartup()).isTrue();
  }
}
