package com.sketchsync.model.crdt;

import com.sketchsync.model.CanvasElement;
import com.sketchsync.model.Cursor;
import com.sketchsync.model.ElementType;
import com.sketchsync.model.SketchDocument;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * One copy of a sketch, stored as its full operation history.
 * <p>
 * The visible document is the replay of every causally ready operation in the total order
 * {@code (lamport, site, seq)}. Because that order extends the happened-before relation and does not
 * depend on arrival order, two replicas holding the same set of operations always materialize the same
 * document. Operations whose dependencies have not arrived yet stay pending until they do.
 * <p>
 * Cursors are kept outside the history as one last-writer-wins register per actor, ordered by
 * {@code (lamport, site)}, so pointer traffic never grows the log.
 * <p>
 * Not thread-safe; the owning store serializes access.
 */
@Slf4j
public class Replica {
    static final Comparator<Operation> REPLAY_ORDER = Comparator
            .comparingLong(Operation::getLamport)
            .thenComparing(operation -> operation.getId().getSite())
            .thenComparingLong(operation -> operation.getId().getSeq());

    @Getter
    private final String actorId;
    @Getter
    private final String siteId;
    private final Map<OperationId, Operation> operations = new HashMap<>();
    private final Map<String, Long> versionVector = new HashMap<>();
    private final Map<String, CursorEntry> cursors = new TreeMap<>();
    private final CanvasState state = new CanvasState();

    private long nextSeq = 1;
    private long lamportClock = 0;
    @Getter
    private int pendingCount = 0;
    private SketchDocument document = SketchDocument.empty();

    public Replica(String actorId) {
        this(actorId, UUID.randomUUID().toString());
    }

    public Replica(String actorId, String siteId) {
        if (actorId == null || siteId == null) {
            throw new IllegalArgumentException("Replica needs an actor id and a site id");
        }
        this.actorId = actorId;
        this.siteId = siteId;
    }

    /**
     * Rebuilds a replica from a saved snapshot. The new replica writes under a fresh site id so it can
     * never reuse an operation id that the saved history or its peers already hold.
     */
    public static Replica fromSnapshot(String actorId, ReplicaSnapshot snapshot) {
        Replica replica = new Replica(actorId);
        replica.merge(snapshot.getOperations());
        replica.mergeCursors(snapshot.getCursors());
        return replica;
    }

    // #### Local mutations

    public Operation initCanvas(String title, long timestamp) {
        return record(Operation.initCanvas(nextId(), actorId, nextLamport(), currentDependencies(), timestamp, title));
    }

    // true if the canvas had to be created
    public boolean ensureCanvas(String title, long timestamp) {
        if (state.isPresent()) {
            return false;
        }
        initCanvas(title, timestamp);
        return true;
    }

    public Operation addElement(CanvasElement element, long timestamp) {
        element.validate();
        return record(Operation.addElement(nextId(), actorId, nextLamport(), currentDependencies(), timestamp, element));
    }

    // Nothing is recorded when no note with that id is known locally
    public Optional<Operation> updateNoteText(String noteId, String text, long timestamp) {
        CanvasElement element = state.findElement(noteId);
        if (element == null || element.getType() != ElementType.NOTE) {
            return Optional.empty();
        }
        return Optional.of(record(Operation.updateNoteText(nextId(), actorId, nextLamport(), currentDependencies(),
                timestamp, noteId, text)));
    }

    public Operation setTitle(String title, long timestamp) {
        return record(Operation.setTitle(nextId(), actorId, nextLamport(), currentDependencies(), timestamp, title));
    }

    public CursorEntry setCursor(String cursorActorId, Cursor cursor) {
        CursorEntry entry = new CursorEntry(cursor, nextLamport(), siteId);
        cursors.put(cursorActorId, entry);
        document = null;
        return entry;
    }

    // #### Replication

    /**
     * Adds every operation not yet known and replays the history if anything was new.
     * Merging is commutative, associative and idempotent.
     *
     * @return the number of operations that were new to this replica
     */
    public int merge(Collection<Operation> incoming) {
        int added = 0;
        for (Operation operation : incoming) {
            Operation existing = operations.putIfAbsent(operation.getId(), operation);
            if (existing == null) {
                added++;
            } else if (!existing.equals(operation)) {
                log.warn("Conflicting content for operation {}, keeping the known version", operation.getId());
            }
        }

        if (added > 0) {
            replay();
            log.debug("Merged {} new operations ({} pending)", added, pendingCount);
        }
        return added;
    }

    // Returns the number of cursor registers that changed
    public int mergeCursors(Map<String, CursorEntry> incoming) {
        int changed = 0;
        for (Map.Entry<String, CursorEntry> entry : incoming.entrySet()) {
            CursorEntry remote = entry.getValue();
            lamportClock = Math.max(lamportClock, remote.getLamport());
            CursorEntry known = cursors.get(entry.getKey());
            if (known == null || remote.supersedes(known)) {
                cursors.put(entry.getKey(), remote);
                changed++;
            }
        }

        if (changed > 0) {
            document = null;
        }
        return changed;
    }

    // Full history in replay order, pending operations included
    public List<Operation> getOperations() {
        List<Operation> ordered = new ArrayList<>(operations.values());
        ordered.sort(REPLAY_ORDER);
        return ordered;
    }

    public Map<String, CursorEntry> getCursors() {
        return Collections.unmodifiableMap(new TreeMap<>(cursors));
    }

    public Map<String, Long> getVersionVector() {
        return Map.copyOf(versionVector);
    }

    public SketchDocument getDocument() {
        if (document == null) {
            Map<String, Cursor> visible = new TreeMap<>();
            cursors.forEach((cursorActorId, entry) -> visible.put(cursorActorId, entry.getCursor()));
            document = state.toDocument(visible);
        }
        return document;
    }

    public boolean hasCanvas() {
        return state.isPresent();
    }

    // #### Private

    private Operation record(Operation operation) {
        operations.put(operation.getId(), operation);
        // A fresh local operation has the highest lamport value, so it is last in replay order
        state.apply(operation);
        versionVector.put(siteId, operation.getId().getSeq());
        document = null;
        return operation;
    }

    private void replay() {
        state.clear();
        versionVector.clear();
        pendingCount = 0;

        for (Operation operation : getOperations()) {
            lamportClock = Math.max(lamportClock, operation.getLamport());
            if (isReady(operation)) {
                state.apply(operation);
                versionVector.put(operation.getId().getSite(), operation.getId().getSeq());
            } else {
                pendingCount++;
            }
        }
        document = null;
    }

    private boolean isReady(Operation operation) {
        OperationId id = operation.getId();
        if (versionVector.getOrDefault(id.getSite(), 0L) != id.getSeq() - 1) {
            return false;
        }
        for (Map.Entry<String, Long> dependency : operation.getDependencies().entrySet()) {
            if (versionVector.getOrDefault(dependency.getKey(), 0L) < dependency.getValue()) {
                return false;
            }
        }
        return true;
    }

    private OperationId nextId() {
        return new OperationId(siteId, nextSeq++);
    }

    private long nextLamport() {
        lamportClock = Math.addExact(lamportClock, 1);
        return lamportClock;
    }

    private Map<String, Long> currentDependencies() {
        return Map.copyOf(versionVector);
    }
}
