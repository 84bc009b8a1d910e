package com.sketchsync.service;

import com.sketchsync.model.crdt.Replica;

@FunctionalInterface
public interface CanvasRepairer {

    void repair(Replica replica);
}
