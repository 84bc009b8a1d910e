package com.sketchsync.model.crdt;

import com.sketchsync.model.Canvas;
import com.sketchsync.model.CanvasElement;
import com.sketchsync.model.Cursor;
import com.sketchsync.model.Note;
import com.sketchsync.model.SketchDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Operations must be applied in replay order
@Slf4j
class CanvasState {
    private boolean present;
    private String title;
    private final List<CanvasElement> elements = new ArrayList<>();
    private final Map<String, Integer> elementIndex = new HashMap<>();

    void apply(Operation operation) {
        switch (operation.getType()) {
            case INIT_CANVAS -> {
                // Idempotent: concurrent initializations from several replicas must not wipe each other
                if (!present) {
                    present = true;
                    title = operation.getText();
                }
            }
            case ADD_ELEMENT -> {
                ensurePresent();
                CanvasElement element = operation.getElement();
                if (elementIndex.containsKey(element.getId())) {
                    log.debug("Ignoring duplicate element {} from {}", element.getId(), operation.getId());
                    return;
                }
                elementIndex.put(element.getId(), elements.size());
                elements.add(element);
            }
            case UPDATE_NOTE_TEXT -> updateNoteText(operation);
            case SET_TITLE -> {
                ensurePresent();
                title = operation.getText();
            }
        }
    }

    boolean isPresent() {
        return present;
    }

    CanvasElement findElement(String id) {
        Integer index = elementIndex.get(id);
        return index == null ? null : elements.get(index);
    }

    void clear() {
        present = false;
        title = null;
        elements.clear();
        elementIndex.clear();
    }

    SketchDocument toDocument(Map<String, Cursor> cursors) {
        if (!present) {
            return SketchDocument.empty();
        }
        return new SketchDocument(new Canvas(elements, cursors, title));
    }

    private void updateNoteText(Operation operation) {
        Integer index = elementIndex.get(operation.getTargetId());
        if (index == null) {
            return;
        }

        CanvasElement element = elements.get(index);
        switch (element.getType()) {
            case NOTE -> elements.set(index, ((Note) element).withText(operation.getText(), operation.getTimestamp()));
            case STROKE -> log.debug("Ignoring note text update for stroke {}", element.getId());
        }
    }

    private void ensurePresent() {
        if (!present) {
            present = true;
            title = Canvas.DEFAULT_TITLE;
        }
    }
}
