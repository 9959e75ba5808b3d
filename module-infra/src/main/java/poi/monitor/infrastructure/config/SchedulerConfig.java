package poi.monitor.infrastructure.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Task scheduler running the monitoring cycle.
 *
 * <ul>
 *   <li><b>waitForTasksToCompleteOnShutdown</b>: an in-flight cycle finishes its current key and
 *       purge before the context closes
 *   <li><b>Metrics</b>: {@code task.scheduler.*} executor metrics and {@code scheduler.rejected}
 * </ul>
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties({SchedulerProperties.class, PoiMonitorProperties.class})
public class SchedulerConfig {

  @Bean
  @ConditionalOnMissingBean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      SchedulerProperties properties, MeterRegistry meterRegistry) {

    Counter rejected =
        Counter.builder("scheduler.rejected")
            .description("Number of scheduled tasks rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("poi-scheduler-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    scheduler.setRejectedExecutionHandler(
        (r, executor) -> {
          rejected.increment();
          if (executor.isShutdown() || executor.isTerminating()) {
            throw new RejectedExecutionException("Scheduler rejected (shutdown in progress)");
          }
          log.warn(
              "[TaskScheduler] Task rejected. poolSize={}, activeCount={}, queueSize={}",
              executor.getPoolSize(),
              executor.getActiveCount(),
              executor.getQueue().size());
          throw new RejectedExecutionException("TaskScheduler queue full");
        });

    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "task.scheduler", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info("[TaskScheduler] Initialized with poolSize={}", properties.poolSize());
    return scheduler;
  }
}
