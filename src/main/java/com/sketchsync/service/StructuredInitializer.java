package com.sketchsync.service;

import com.sketchsync.config.SketchProperties;
import com.sketchsync.model.Canvas;
import com.sketchsync.model.CanvasElement;
import com.sketchsync.model.crdt.Replica;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@Order(1)
public class StructuredInitializer implements DocumentInitializer {
    private final Clock clock;
    private final Canvas template;

    @Autowired
    public StructuredInitializer(SketchProperties properties, Clock clock) {
        this(Canvas.empty(properties.getDocument().getDefaultTitle()), clock);
    }

    StructuredInitializer(Canvas template, Clock clock) {
        this.template = template;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "structured";
    }

    @Override
    public InitializationResult initialize(String actorId) {
        try {
            long now = clock.millis();
            Replica replica = new Replica(actorId);
            replica.initCanvas(template.getTitle(), now);
            for (CanvasElement element : template.getElements()) {
                replica.addElement(element, now);
            }
            return InitializationResult.success(replica);
        } catch (RuntimeException e) {
            return InitializationResult.failure("Could not create document from template: " + e.getMessage());
        }
    }
}
