package com.sketchsync.service;

import com.sketchsync.model.crdt.Replica;
import lombok.Getter;

@Getter
public final class InitializationResult {
    private final Replica replica;
    private final String error;

    private InitializationResult(Replica replica, String error) {
        this.replica = replica;
        this.error = error;
    }

    public static InitializationResult success(Replica replica) {
        return new InitializationResult(replica, null);
    }

    public static InitializationResult failure(String error) {
        return new InitializationResult(null, error);
    }

    public boolean isSuccess() {
        return replica != null;
    }
}
