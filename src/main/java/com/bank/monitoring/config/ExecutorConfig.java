package com.bank.monitoring.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Threads and clients used off the request path: the single-threaded alert check
 * scheduler and the bounded pool that carries out-of-band notifications.
 */
@Configuration
public class ExecutorConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One thread: alert checks never run concurrently with each other.
    @Bean(name = "alertTaskScheduler")
    public TaskScheduler alertTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("alert-check-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = NOTIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("alert-notify-");
        // Full queue: drop the notification rather than block the dispatcher
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, WebhookNotificationConfig config) {
        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
