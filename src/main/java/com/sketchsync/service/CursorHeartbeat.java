package com.sketchsync.service;

import com.sketchsync.model.Point;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

// Pointer moves from the UI plus a fixed-rate tick that keeps a stationary pointer live for peers
@Slf4j
@Component
public class CursorHeartbeat {
    private final ReplicaStore store;
    private final IdentityService identityService;

    private volatile Point lastPosition;

    @Autowired
    public CursorHeartbeat(ReplicaStore store, IdentityService identityService) {
        this.store = store;
        this.identityService = identityService;
    }

    public void pointerMoved(double x, double y) {
        lastPosition = new Point(x, y);
        store.updateCursor(identityService.getActorId(), x, y);
    }

    @Scheduled(fixedRateString = "${sketch.presence.heartbeat-interval-ms:1000}")
    public void heartbeat() {
        Point position = lastPosition;
        if (position == null) {
            return;
        }
        log.trace("Cursor heartbeat at {}", position);
        store.updateCursor(identityService.getActorId(), position.getX(), position.getY());
    }
}
