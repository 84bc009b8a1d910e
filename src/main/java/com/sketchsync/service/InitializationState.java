package com.sketchsync.service;

public enum InitializationState {
    UNINITIALIZED,
    READY,
    // document exists but has no canvas; repaired on the next mutation
    DEGRADED,
    // no usable document until reset()
    FAILED
}
