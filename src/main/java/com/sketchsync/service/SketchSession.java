package com.sketchsync.service;

import com.sketchsync.model.Cursor;
import com.sketchsync.model.Point;
import com.sketchsync.model.SketchDocument;
import com.sketchsync.transport.ConnectionState;
import com.sketchsync.transport.SyncTransport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class SketchSession {
    private final ReplicaStore store;
    private final SyncTransport transport;
    private final PresenceTracker presenceTracker;
    private final CursorHeartbeat cursorHeartbeat;
    private final ObjectProvider<SnapshotExporter> snapshotExporter;

    @Autowired
    public SketchSession(ReplicaStore store,
                         SyncTransport transport,
                         PresenceTracker presenceTracker,
                         CursorHeartbeat cursorHeartbeat,
                         ObjectProvider<SnapshotExporter> snapshotExporter) {
        this.store = store;
        this.transport = transport;
        this.presenceTracker = presenceTracker;
        this.cursorHeartbeat = cursorHeartbeat;
        this.snapshotExporter = snapshotExporter;
    }

    public SketchDocument getDocument() {
        return store.getDocument();
    }

    public String getActorId() {
        return store.getActorId();
    }

    public SketchDocument addStroke(List<Point> points, String color, int width) {
        return store.addStroke(points, color, width);
    }

    public SketchDocument addNote(String text, Point position, String color) {
        return store.addNote(text, position, color);
    }

    public SketchDocument updateNote(String id, String text) {
        return store.updateNote(id, text);
    }

    public SketchDocument updateTitle(String title) {
        return store.updateTitle(title);
    }

    public SketchDocument updateCursor(double x, double y) {
        return store.updateCursor(store.getActorId(), x, y);
    }

    public void pointerMoved(double x, double y) {
        cursorHeartbeat.pointerMoved(x, y);
    }

    public SketchDocument reset() {
        return store.reset();
    }

    public Map<String, Cursor> liveCursors() {
        return presenceTracker.liveCursors();
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public ConnectionState getConnectionState() {
        return transport.getState();
    }

    public Optional<String> getInitializationError() {
        return store.getInitializationError();
    }

    // Empty unless a rendering collaborator is registered
    public Optional<byte[]> exportSnapshot() {
        SnapshotExporter exporter = snapshotExporter.getIfAvailable();
        if (exporter == null) {
            return Optional.empty();
        }
        return exporter.export(store.getDocument());
    }
}
