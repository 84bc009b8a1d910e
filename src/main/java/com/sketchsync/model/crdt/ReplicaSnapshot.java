package com.sketchsync.model.crdt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.List;
import java.util.Map;

// Wire and save format of a replica, loadable on its own
@Getter
public class ReplicaSnapshot {
    private final int formatVersion;
    private final List<Operation> operations;
    private final Map<String, CursorEntry> cursors;

    @JsonCreator
    public ReplicaSnapshot(@JsonProperty("formatVersion") int formatVersion,
                           @JsonProperty("operations") List<Operation> operations,
                           @JsonProperty("cursors") Map<String, CursorEntry> cursors) {
        this.formatVersion = formatVersion;
        this.operations = operations;
        this.cursors = cursors;
    }
}
