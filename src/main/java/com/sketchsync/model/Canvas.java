package com.sketchsync.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Getter
@EqualsAndHashCode
@ToString
public final class Canvas {
    public static final String DEFAULT_TITLE = "Untitled Sketch";

    private final List<CanvasElement> elements;
    private final Map<String, Cursor> cursors;
    private final String title;

    public Canvas(List<CanvasElement> elements, Map<String, Cursor> cursors, String title) {
        this.elements = List.copyOf(elements);
        this.cursors = Collections.unmodifiableMap(new TreeMap<>(cursors));
        this.title = title;
    }

    public static Canvas empty(String title) {
        return new Canvas(List.of(), new LinkedHashMap<>(), title);
    }

    public Optional<CanvasElement> findElement(String id) {
        return elements.stream()
                .filter(element -> element.getId().equals(id))
                .findFirst();
    }
}
