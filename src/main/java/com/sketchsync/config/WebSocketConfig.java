package com.sketchsync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(SketchProperties.class)
public class WebSocketConfig {

    @Bean
    public WebSocketClient webSocketClient() {
        // JSR-356 client, backed by the Tomcat websocket container on the classpath
        return new StandardWebSocketClient();
    }

    // Runs reconnect timers and the cursor heartbeat
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sketch-sync-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
