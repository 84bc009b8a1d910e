package com.sketchsync.model.crdt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sketchsync.model.CanvasElement;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * One recorded mutation of a sketch.
 * <p>
 * Besides its payload every operation carries its causal stamp: the id assigned by the
 * originating site, a Lamport counter, and the version vector (site to highest applied sequence)
 * the originator had seen when it was created. Cursors are not operations, see {@link CursorEntry}.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Operation {
    public enum OperationType {
        INIT_CANVAS,
        ADD_ELEMENT,
        UPDATE_NOTE_TEXT,
        SET_TITLE
    }

    // Upper bound for lamport values accepted from peers, leaves room to keep counting
    public static final long MAX_LAMPORT = 1L << 62;

    private final OperationId id;
    private final String actorId;
    private final long lamport;
    private final Map<String, Long> dependencies;
    private final long timestamp;
    private final OperationType type;
    private final CanvasElement element;
    // note id for UPDATE_NOTE_TEXT
    private final String targetId;
    // title for INIT_CANVAS and SET_TITLE, note text for UPDATE_NOTE_TEXT
    private final String text;

    public static Operation initCanvas(OperationId id, String actorId, long lamport,
                                       Map<String, Long> dependencies, long timestamp, String title) {
        return new Operation(id, actorId, lamport, dependencies, timestamp,
                OperationType.INIT_CANVAS, null, null, title);
    }

    public static Operation addElement(OperationId id, String actorId, long lamport,
                                       Map<String, Long> dependencies, long timestamp, CanvasElement element) {
        return new Operation(id, actorId, lamport, dependencies, timestamp,
                OperationType.ADD_ELEMENT, element, null, null);
    }

    public static Operation updateNoteText(OperationId id, String actorId, long lamport,
                                           Map<String, Long> dependencies, long timestamp,
                                           String noteId, String text) {
        return new Operation(id, actorId, lamport, dependencies, timestamp,
                OperationType.UPDATE_NOTE_TEXT, null, noteId, text);
    }

    public static Operation setTitle(OperationId id, String actorId, long lamport,
                                     Map<String, Long> dependencies, long timestamp, String title) {
        return new Operation(id, actorId, lamport, dependencies, timestamp,
                OperationType.SET_TITLE, null, null, title);
    }

    @JsonCreator
    Operation(@JsonProperty("id") OperationId id,
              @JsonProperty("actorId") String actorId,
              @JsonProperty("lamport") long lamport,
              @JsonProperty("dependencies") Map<String, Long> dependencies,
              @JsonProperty("timestamp") long timestamp,
              @JsonProperty("type") OperationType type,
              @JsonProperty("element") CanvasElement element,
              @JsonProperty("targetId") String targetId,
              @JsonProperty("text") String text) {
        this.id = id;
        this.actorId = actorId;
        this.lamport = lamport;
        this.dependencies = dependencies == null ? null : Map.copyOf(dependencies);
        this.timestamp = timestamp;
        this.type = type;
        this.element = element;
        this.targetId = targetId;
        this.text = text;
    }

    // Rejects operations that no replica could replay deterministically
    public void validate() {
        if (id == null || id.getSite() == null || id.getSite().isBlank() || id.getSeq() < 1) {
            throw new IllegalArgumentException("Operation has an invalid id: " + id);
        }
        if (actorId == null) {
            throw new IllegalArgumentException("Operation " + id + " has no actor");
        }
        if (lamport < 1 || lamport > MAX_LAMPORT) {
            throw new IllegalArgumentException("Operation " + id + " has an invalid lamport counter " + lamport);
        }
        if (dependencies == null) {
            throw new IllegalArgumentException("Operation " + id + " has no dependency vector");
        }
        if (type == null) {
            throw new IllegalArgumentException("Operation " + id + " has no type");
        }

        switch (type) {
            case INIT_CANVAS, SET_TITLE -> require(text != null, "a title");
            case ADD_ELEMENT -> {
                require(element != null, "an element");
                element.validate();
            }
            case UPDATE_NOTE_TEXT -> require(targetId != null && text != null, "a note id and text");
        }
    }

    private void require(boolean condition, String what) {
        if (!condition) {
            throw new IllegalArgumentException(type + " operation " + id + " requires " + what);
        }
    }
}
