package com.sketchsync.service;

import com.sketchsync.config.SketchProperties;
import com.sketchsync.model.Cursor;
import com.sketchsync.model.Note;
import com.sketchsync.model.Point;
import com.sketchsync.model.SketchDocument;
import com.sketchsync.model.Stroke;
import com.sketchsync.model.crdt.Operation;
import com.sketchsync.model.crdt.Replica;
import com.sketchsync.model.crdt.ReplicaSnapshot;
import com.sketchsync.model.crdt.SnapshotCodec;
import com.sketchsync.model.crdt.SnapshotFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Owner of the local replica and the only place the document is mutated.
 * <p>
 * Every mutation is applied to the local replica synchronously and returns the new immutable
 * snapshot, whether or not a connection exists. Afterwards a {@link DocumentChangedEvent} is
 * published so the transport can broadcast and observers can re-render.
 * <p>
 * Changes to the replica are mutually exclusive, so no caller ever sees a half-applied change.
 * Events are published after the lock is released; listeners may call back into the store.
 */
@Slf4j
@Service
public class ReplicaStore {
    private final IdentityService identityService;
    private final List<DocumentInitializer> initializers;
    private final CanvasRepairer canvasRepairer;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxRepairAttempts;
    private final SnapshotCodec codec = new SnapshotCodec();

    private Replica replica;
    private SketchDocument document = SketchDocument.empty();
    private InitializationState initializationState = InitializationState.UNINITIALIZED;
    private String initializationError;
    private int repairAttempts;

    @Autowired
    public ReplicaStore(IdentityService identityService,
                        List<DocumentInitializer> initializers,
                        CanvasRepairer canvasRepairer,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock,
                        SketchProperties properties) {
        this.identityService = identityService;
        this.initializers = List.copyOf(initializers);
        this.canvasRepairer = canvasRepairer;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxRepairAttempts = properties.getDocument().getMaxRepairAttempts();

        initialize();
    }

    // #### Mutations

    public SketchDocument addStroke(List<Point> points, String color, int width) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("A stroke needs at least one point");
        }
        if (points.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Stroke points must not be null");
        }
        if (width <= 0) {
            throw new IllegalArgumentException("Stroke width must be positive, got " + width);
        }

        return mutate("add stroke", replica -> {
            long now = clock.millis();
            replica.addElement(new Stroke(generateId(), getActorId(), now, points, color, width), now);
            return true;
        });
    }

    public SketchDocument addNote(String text, Point position, String color) {
        if (position == null) {
            throw new IllegalArgumentException("A note needs a position");
        }

        return mutate("add note", replica -> {
            long now = clock.millis();
            replica.addElement(new Note(generateId(), getActorId(), now, text, position, color), now);
            return true;
        });
    }

    // Unknown ids and ids of other element kinds are ignored
    public SketchDocument updateNote(String id, String text) {
        return mutate("update note", replica -> {
            Optional<Operation> operation = replica.updateNoteText(id, text == null ? "" : text, clock.millis());
            if (operation.isEmpty()) {
                log.debug("No note with id {}, nothing to update", id);
            }
            return operation.isPresent();
        });
    }

    public SketchDocument updateTitle(String title) {
        return mutate("update title", replica -> {
            replica.setTitle(title == null ? "" : title, clock.millis());
            return true;
        });
    }

    public SketchDocument updateCursor(String actorId, double x, double y) {
        if (actorId == null) {
            throw new IllegalArgumentException("Cursor updates need an actor id");
        }

        return mutate("update cursor", replica -> {
            replica.setCursor(actorId, new Cursor(new Point(x, y), clock.millis()));
            return true;
        });
    }

    // #### Replication

    /**
     * Merges a snapshot received from a peer. Payloads that cannot be decoded or validated are
     * dropped whole and the current document is returned unchanged.
     */
    public SketchDocument mergeIncoming(byte[] remoteBytes) {
        SketchDocument before;
        SketchDocument after;
        synchronized (this) {
            before = document;
            after = applyIncoming(remoteBytes);
        }
        if (after != before) {
            publish(after, ChangeOrigin.REMOTE);
        }
        return after;
    }

    // Full operation history plus the cursor registers, which is what peers need to merge later on
    public synchronized byte[] save() {
        if (replica == null) {
            return codec.encode(List.of(), Map.of());
        }
        return codec.encode(replica.getOperations(), replica.getCursors());
    }

    // Invalid input leaves the store untouched
    public boolean load(byte[] savedBytes) {
        SketchDocument loaded;
        synchronized (this) {
            ReplicaSnapshot snapshot;
            try {
                snapshot = codec.decode(savedBytes);
            } catch (SnapshotFormatException e) {
                log.warn("Could not load snapshot: {}", e.getMessage());
                return false;
            }

            replica = Replica.fromSnapshot(getActorId(), snapshot);
            document = replica.getDocument();
            repairAttempts = 0;
            initializationError = null;
            initializationState = replica.hasCanvas() ? InitializationState.READY : InitializationState.DEGRADED;
            log.info("Loaded snapshot with {} operations", snapshot.getOperations().size());
            loaded = document;
        }
        publish(loaded, ChangeOrigin.LOADED);
        return true;
    }

    // Discards all history and starts over with a freshly initialized document
    public SketchDocument reset() {
        SketchDocument fresh;
        synchronized (this) {
            log.info("Resetting document to fresh state");
            replica = null;
            repairAttempts = 0;
            initializationError = null;
            initialize();
            fresh = document;
        }
        publish(fresh, ChangeOrigin.RESET);
        return fresh;
    }

    // #### Status

    public synchronized SketchDocument getDocument() {
        return document;
    }

    public String getActorId() {
        return identityService.getActorId();
    }

    public synchronized InitializationState getInitializationState() {
        return initializationState;
    }

    public synchronized Optional<String> getInitializationError() {
        return Optional.ofNullable(initializationError);
    }

    // #### Private

    private SketchDocument mutate(String action, Predicate<Replica> change) {
        SketchDocument before;
        SketchDocument after;
        synchronized (this) {
            before = document;
            after = applyLocal(action, change);
        }
        if (after != before) {
            publish(after, ChangeOrigin.LOCAL);
        }
        return after;
    }

    private SketchDocument applyLocal(String action, Predicate<Replica> change) {
        if (initializationState == InitializationState.FAILED) {
            log.debug("Cannot {}: {}", action, initializationError);
            return document;
        }

        boolean repaired = !replica.hasCanvas();
        if (repaired && !ensureCanvas(action)) {
            return document;
        }

        boolean changed = change.test(replica);
        if (changed || repaired) {
            document = replica.getDocument();
        }
        return document;
    }

    private SketchDocument applyIncoming(byte[] remoteBytes) {
        if (replica == null) {
            log.warn("Ignoring incoming snapshot: document not initialized");
            return document;
        }

        ReplicaSnapshot snapshot;
        try {
            snapshot = codec.decode(remoteBytes);
        } catch (SnapshotFormatException e) {
            log.warn("Rejected incoming snapshot: {}", e.getMessage());
            return document;
        }

        int added = replica.merge(snapshot.getOperations());
        int cursorsChanged = replica.mergeCursors(snapshot.getCursors());
        if (replica.hasCanvas() && initializationState == InitializationState.DEGRADED) {
            initializationState = InitializationState.READY;
        }
        boolean repaired = !replica.hasCanvas() && initializationState != InitializationState.FAILED
                && ensureCanvas("merge incoming snapshot");
        if (added == 0 && cursorsChanged == 0 && !repaired) {
            log.debug("Incoming snapshot contained nothing new");
            return document;
        }

        document = replica.getDocument();
        log.debug("Merged {} operations and {} cursors from peer", added, cursorsChanged);
        return document;
    }

    private boolean ensureCanvas(String action) {
        if (replica.hasCanvas()) {
            return true;
        }
        if (repairAttempts >= maxRepairAttempts) {
            exhaust();
            return false;
        }

        repairAttempts++;
        log.warn("Document not properly initialized before {} (attempt {}/{}), repairing canvas",
                action, repairAttempts, maxRepairAttempts);
        try {
            canvasRepairer.repair(replica);
        } catch (RuntimeException e) {
            log.error("Error repairing document", e);
            initializationError = "Failed to initialize document: " + e.getMessage();
        }

        if (replica.hasCanvas()) {
            initializationState = InitializationState.READY;
            initializationError = null;
            return true;
        }
        if (initializationError == null) {
            initializationError = "Failed to initialize document: repair did not produce a canvas";
        }
        if (repairAttempts >= maxRepairAttempts) {
            exhaust();
        }
        return false;
    }

    private void exhaust() {
        initializationState = InitializationState.FAILED;
        initializationError = "Document initialization exhausted after " + maxRepairAttempts + " attempts";
        log.error("{}, reset required", initializationError);
    }

    private void initialize() {
        String actorId = getActorId();
        List<String> failures = new ArrayList<>();

        for (DocumentInitializer initializer : initializers) {
            InitializationResult result;
            try {
                result = initializer.initialize(actorId);
            } catch (RuntimeException e) {
                result = InitializationResult.failure(e.getMessage());
            }

            if (result.isSuccess()) {
                replica = result.getReplica();
                document = replica.getDocument();
                initializationState = replica.hasCanvas() ? InitializationState.READY : InitializationState.DEGRADED;
                log.info("Document initialized with {} strategy ({})", initializer.getName(), initializationState);
                return;
            }

            log.warn("{} initialization failed: {}", initializer.getName(), result.getError());
            failures.add(initializer.getName() + ": " + result.getError());
        }

        replica = null;
        document = SketchDocument.empty();
        initializationState = InitializationState.FAILED;
        initializationError = "Failed to initialize document: " + String.join("; ", failures);
        log.error(initializationError);
    }

    private void publish(SketchDocument changed, ChangeOrigin origin) {
        eventPublisher.publishEvent(new DocumentChangedEvent(changed, origin));
    }

    private static String generateId() {
        return UUID.randomUUID().toString();
    }
}
