package com.sketchsync.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Optional;

/**
 * Immutable snapshot of a replica's state.
 * <p>
 * A healthy document always carries a {@link Canvas}. The canvas is absent only while a replica is
 * degraded (bare initialization or an incoming history that never created one); the store repairs
 * it before the next mutation is applied.
 */
@EqualsAndHashCode
@ToString
public final class SketchDocument {
    private static final SketchDocument EMPTY = new SketchDocument(null);

    private final Canvas canvas;

    public SketchDocument(Canvas canvas) {
        this.canvas = canvas;
    }

    public static SketchDocument empty() {
        return EMPTY;
    }

    public Optional<Canvas> getCanvas() {
        return Optional.ofNullable(canvas);
    }

    public boolean hasCanvas() {
        return canvas != null;
    }
}
