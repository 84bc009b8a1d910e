package com.sketchsync.config;

import com.sketchsync.model.Canvas;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "sketch")
public class SketchProperties {
    private final Sync sync = new Sync();
    private final Presence presence = new Presence();
    private final Identity identity = new Identity();
    private final DocumentSettings document = new DocumentSettings();

    @Data
    public static class Sync {
        private URI url = URI.create("ws://localhost:4080/sync");
        private boolean autoConnect = true;
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int sendBufferSizeLimit = 5 * 1024 * 1024;
        // Upper bound for one reassembled inbound frame
        private int maxMessageSize = 16 * 1024 * 1024;
        private final Reconnect reconnect = new Reconnect();
    }

    @Data
    public static class Reconnect {
        private Duration delay = Duration.ofSeconds(5);
        // 1.0 keeps the delay fixed
        private double multiplier = 1.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        // 0 retries forever
        private int maxAttempts = 0;
    }

    @Data
    public static class Presence {
        private Duration livenessWindow = Duration.ofSeconds(10);
        private long heartbeatIntervalMs = 1000;
    }

    @Data
    public static class Identity {
        private Path file = Paths.get(System.getProperty("user.home"), ".sketchsync", "identity.properties");
    }

    @Data
    public static class DocumentSettings {
        private String defaultTitle = Canvas.DEFAULT_TITLE;
        private int maxRepairAttempts = 3;
    }
}
