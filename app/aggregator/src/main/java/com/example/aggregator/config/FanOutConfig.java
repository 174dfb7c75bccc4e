package com.example.aggregator.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class FanOutConfig {

  /**
   * Executor for per-item follow-up calls.
   *
   * <p>Direct hand-off: a task never waits in a queue behind other requests' tasks. When every
   * worker is busy the submitting request thread runs the task itself.
   */
  @Bean(name = "fanOutExecutor")
  ThreadPoolTaskExecutor fanOutExecutor(GatewayProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.fanOut().corePoolSize());
    executor.setMaxPoolSize(properties.fanOut().maxPoolSize());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("fan-out-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  static TaskDecorator mdcPropagatingDecorator() {
    return task -> {
      final Map<String, String> submitted = MDC.getCopyOfContextMap();
      return () -> {
        final Map<String, String> previous = MDC.getCopyOfContextMap();
        restore(submitted);
        try {
          task.run();
        } finally {
          restore(previous);
        }
      };
    };
  }

  private static void restore(Map<String, String> context) {
    if (context == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }
}
