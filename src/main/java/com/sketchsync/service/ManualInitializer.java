package com.sketchsync.service;

import com.sketchsync.config.SketchProperties;
import com.sketchsync.model.crdt.Replica;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;

// Empty replica first, canvas added as a separate change
@Component
@Order(2)
public class ManualInitializer implements DocumentInitializer {
    private final String defaultTitle;
    private final Clock clock;

    @Autowired
    public ManualInitializer(SketchProperties properties, Clock clock) {
        this.defaultTitle = properties.getDocument().getDefaultTitle();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "manual";
    }

    @Override
    public InitializationResult initialize(String actorId) {
        try {
            Replica replica = new Replica(actorId);
            replica.ensureCanvas(defaultTitle, clock.millis());
            if (!replica.hasCanvas()) {
                return InitializationResult.failure("Canvas change did not produce a canvas");
            }
            return InitializationResult.success(replica);
        } catch (RuntimeException e) {
            return InitializationResult.failure("Could not add canvas to empty document: " + e.getMessage());
        }
    }
}
