package com.sketchsync.model.crdt;

public class SnapshotFormatException extends Exception {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
