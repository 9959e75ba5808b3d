package poi.monitor.infrastructure.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import poi.monitor.infrastructure.executor.DefaultLogicExecutor;
import poi.monitor.infrastructure.executor.LogicExecutor;
import poi.monitor.infrastructure.executor.strategy.ExceptionTranslator;

@Configuration
public class ExecutorConfig {

  @Bean
  public ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(
      ExceptionTranslator exceptionTranslator, PoiMonitorProperties properties) {
    return new DefaultLogicExecutor(
        exceptionTranslator, properties.getSlowTaskThreshold().toMillis());
  }
}
