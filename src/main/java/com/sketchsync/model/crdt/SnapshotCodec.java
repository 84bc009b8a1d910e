package com.sketchsync.model.crdt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encodes replicas as CBOR {@link ReplicaSnapshot}s and validates what it decodes.
 * A snapshot is accepted whole or not at all.
 */
public class SnapshotCodec {
    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper = CBORMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public byte[] encode(List<Operation> operations, Map<String, CursorEntry> cursors) {
        try {
            return mapper.writeValueAsBytes(new ReplicaSnapshot(FORMAT_VERSION, operations, cursors));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode replica snapshot", e);
        }
    }

    public ReplicaSnapshot decode(byte[] bytes) throws SnapshotFormatException {
        if (bytes == null || bytes.length == 0) {
            throw new SnapshotFormatException("Snapshot is empty");
        }

        ReplicaSnapshot snapshot;
        try {
            snapshot = mapper.readValue(bytes, ReplicaSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotFormatException("Snapshot could not be decoded: " + e.getMessage(), e);
        }

        if (snapshot == null || snapshot.getOperations() == null) {
            throw new SnapshotFormatException("Snapshot has no operation list");
        }
        if (snapshot.getFormatVersion() != FORMAT_VERSION) {
            throw new SnapshotFormatException("Unsupported snapshot format version " + snapshot.getFormatVersion());
        }

        Set<OperationId> seen = new HashSet<>();
        for (Operation operation : snapshot.getOperations()) {
            if (operation == null) {
                throw new SnapshotFormatException("Snapshot contains an empty operation");
            }
            try {
                operation.validate();
            } catch (IllegalArgumentException e) {
                throw new SnapshotFormatException("Invalid operation in snapshot: " + e.getMessage(), e);
            }
            if (!seen.add(operation.getId())) {
                throw new SnapshotFormatException("Snapshot contains operation " + operation.getId() + " twice");
            }
        }

        Map<String, CursorEntry> cursors = snapshot.getCursors() == null ? Map.of() : snapshot.getCursors();
        for (Map.Entry<String, CursorEntry> entry : cursors.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                throw new SnapshotFormatException("Snapshot contains a cursor without actor or value");
            }
            try {
                entry.getValue().validate();
            } catch (IllegalArgumentException e) {
                throw new SnapshotFormatException("Invalid cursor for " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return new ReplicaSnapshot(snapshot.getFormatVersion(), snapshot.getOperations(), cursors);
    }
}
