package com.sketchsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Stroke.class, name = "stroke"),
        @JsonSubTypes.Type(value = Note.class, name = "note")
})
public abstract sealed class CanvasElement permits Stroke, Note {
    private final String id;
    private final String creator;
    private final long timestamp;

    protected CanvasElement(String id, String creator, long timestamp) {
        this.id = id;
        this.creator = creator;
        this.timestamp = timestamp;
    }

    @JsonIgnore
    public abstract ElementType getType();

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Element id is required");
        }
        if (creator == null) {
            throw new IllegalArgumentException("Element " + id + " has no creator");
        }
    }
}
