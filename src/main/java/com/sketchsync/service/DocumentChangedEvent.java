package com.sketchsync.service;

import com.sketchsync.model.SketchDocument;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DocumentChangedEvent {
    private final SketchDocument document;
    private final ChangeOrigin origin;

    public DocumentChangedEvent(SketchDocument document, ChangeOrigin origin) {
        this.document = document;
        this.origin = origin;
    }
}
