package com.sketchsync.model.crdt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sketchsync.model.Cursor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public final class CursorEntry {
    private final Cursor cursor;
    private final long lamport;
    private final String site;

    @JsonCreator
    public CursorEntry(@JsonProperty("cursor") Cursor cursor,
                       @JsonProperty("lamport") long lamport,
                       @JsonProperty("site") String site) {
        this.cursor = cursor;
        this.lamport = lamport;
        this.site = site;
    }

    // Same total order as operation replay, so every replica keeps the same cursor
    public boolean supersedes(CursorEntry other) {
        if (lamport != other.lamport) {
            return lamport > other.lamport;
        }
        return site.compareTo(other.site) > 0;
    }

    public void validate() {
        if (cursor == null || cursor.getPosition() == null) {
            throw new IllegalArgumentException("Cursor entry has no position");
        }
        if (lamport < 1 || lamport > Operation.MAX_LAMPORT) {
            throw new IllegalArgumentException("Cursor entry has an invalid lamport counter " + lamport);
        }
        if (site == null || site.isBlank()) {
            throw new IllegalArgumentException("Cursor entry has no site");
        }
    }
}
