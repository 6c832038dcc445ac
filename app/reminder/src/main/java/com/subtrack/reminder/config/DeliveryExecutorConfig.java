/*
 * Where: Reminder application infrastructure configuration
 * What: Bounded thread pool that runs individual reminder sends
 * Why: Each send is blocking I/O that must be cut off by a timeout
 */
package com.subtrack.reminder.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DeliveryExecutorConfig {

  public static final String DELIVERY_EXECUTOR = "reminderDeliveryExecutor";

  @Bean(name = DELIVERY_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService reminderDeliveryExecutor(ReminderDeliveryProperties properties) {
    return Executors.newFixedThreadPool(
        properties.executorThreads(),
        new ThreadFactoryBuilder().setNameFormat("reminder-delivery-%d").setDaemon(true).build());
  }
}
