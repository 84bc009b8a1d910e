package com.sketchsync.service;

import com.sketchsync.model.SketchDocument;

import java.util.Optional;

// Implemented by a rendering collaborator
public interface SnapshotExporter {

    Optional<byte[]> export(SketchDocument document);
}
