package com.sketchsync.transport;

import com.sketchsync.config.SketchProperties;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

// A multiplier of 1 gives a fixed delay, maxAttempts <= 0 retries forever
@Getter
@ToString
public class ReconnectPolicy {
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ReconnectPolicy(Duration initialDelay, double multiplier, Duration maxDelay, int maxAttempts) {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("Reconnect delay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Reconnect multiplier must be at least 1.0, got " + multiplier);
        }
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay == null || maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectPolicy from(SketchProperties.Reconnect properties) {
        return new ReconnectPolicy(properties.getDelay(), properties.getMultiplier(),
                properties.getMaxDelay(), properties.getMaxAttempts());
    }

    /**
     * @param attempt 1 for the first attempt after a connection was lost
     * @return the delay to wait, or empty if no further attempt should be made
     */
    public Optional<Duration> delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempts are counted from 1, got " + attempt);
        }
        if (maxAttempts > 0 && attempt > maxAttempts) {
            return Optional.empty();
        }

        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Optional.of(Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis())));
    }
}
