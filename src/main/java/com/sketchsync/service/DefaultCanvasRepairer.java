package com.sketchsync.service;

import com.sketchsync.config.SketchProperties;
import com.sketchsync.model.crdt.Replica;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

// INIT_CANVAS is idempotent, so concurrent repairs on several replicas merge into one canvas
@Component
public class DefaultCanvasRepairer implements CanvasRepairer {
    private final String defaultTitle;
    private final Clock clock;

    @Autowired
    public DefaultCanvasRepairer(SketchProperties properties, Clock clock) {
        this.defaultTitle = properties.getDocument().getDefaultTitle();
        this.clock = clock;
    }

    @Override
    public void repair(Replica replica) {
        replica.ensureCanvas(defaultTitle, clock.millis());
    }
}
