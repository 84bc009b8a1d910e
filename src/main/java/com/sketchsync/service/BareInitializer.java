package com.sketchsync.service;

import com.sketchsync.model.crdt.Replica;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

// Last resort, degraded until the store repairs it
@Component
@Order(3)
public class BareInitializer implements DocumentInitializer {

    @Override
    public String getName() {
        return "bare";
    }

    @Override
    public InitializationResult initialize(String actorId) {
        try {
            return InitializationResult.success(new Replica(actorId));
        } catch (RuntimeException e) {
            return InitializationResult.failure("Could not create empty document: " + e.getMessage());
        }
    }
}
