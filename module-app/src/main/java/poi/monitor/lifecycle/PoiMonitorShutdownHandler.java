package poi.monitor.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import poi.monitor.service.PoiMonitorService;

/**
 * Asks the running cycle to stop before the scheduler and the datasource are torn down.
 *
 * <p>Highest phase, so it stops first. The in-flight key finishes its current step; keys not yet
 * started are left for the next process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoiMonitorShutdownHandler implements SmartLifecycle {

  private final PoiMonitorService monitorService;

  private volatile boolean running = false;

  @Override
  public void start() {
    running = true;
    log.debug("[PoiMonitorShutdown] Started");
  }

  @Override
  public void stop() {
    log.info("[PoiMonitorShutdown] Requesting cycle stop");
    monitorService.requestStop();
    running = false;
  }

  @Override
  public int getPhase() {
    return Integer.MAX_VALUE;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return true;
  }
}
