package io.eventboard.notification.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class ExecutorConfig {

  /** Runs the per-connection drain tasks; each connection has at most one task in flight. */
  @Bean(name = "connectionWriterExecutor", destroyMethod = "shutdown")
  ExecutorService connectionWriterExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("ws-writer-%d").setDaemon(true).build());
  }

  // @EnableWebSocket が SockJS 用 scheduler を登録するため、@Scheduled 用を明示する
  @Bean
  ThreadPoolTaskScheduler taskScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("notification-scheduler-");
    return scheduler;
  }
}
