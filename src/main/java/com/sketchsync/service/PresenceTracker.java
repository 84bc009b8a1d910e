package com.sketchsync.service;

import com.sketchsync.config.SketchProperties;
import com.sketchsync.model.Cursor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides which remote cursors are worth showing.
 * <p>
 * Liveness is a read-time filter: a cursor is live while it was refreshed within the liveness window,
 * and the caller's own cursor is never part of the result. Nothing is ever removed from the document.
 */
@Service
public class PresenceTracker {
    private final ReplicaStore store;
    private final IdentityService identityService;
    private final Clock clock;
    private final Duration livenessWindow;

    @Autowired
    public PresenceTracker(ReplicaStore store, IdentityService identityService, Clock clock,
                           SketchProperties properties) {
        this.store = store;
        this.identityService = identityService;
        this.clock = clock;
        this.livenessWindow = properties.getPresence().getLivenessWindow();
    }

    public Map<String, Cursor> liveCursors() {
        return store.getDocument().getCanvas()
                .map(canvas -> liveCursors(canvas.getCursors(), identityService.getActorId(), clock.millis()))
                .orElse(Map.of());
    }

    public Map<String, Cursor> liveCursors(Map<String, Cursor> cursors, String currentActorId, long now) {
        Map<String, Cursor> live = new TreeMap<>();
        cursors.forEach((actorId, cursor) -> {
            if (!actorId.equals(currentActorId) && isLive(cursor, now)) {
                live.put(actorId, cursor);
            }
        });
        return live;
    }

    public boolean isLive(Cursor cursor, long now) {
        return now - cursor.getLastActive() < livenessWindow.toMillis();
    }
}
