package com.sketchsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

// Staleness is decided at read time, entries are never removed
@Getter
@EqualsAndHashCode
@ToString
public final class Cursor {
    private final Point position;
    private final long lastActive;

    @JsonCreator
    public Cursor(@JsonProperty("position") Point position, @JsonProperty("lastActive") long lastActive) {
        this.position = position;
        this.lastActive = lastActive;
    }
}
