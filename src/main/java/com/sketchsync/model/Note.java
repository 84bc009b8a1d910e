package com.sketchsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class Note extends CanvasElement {
    private final String text;
    private final Point position;
    private final String color;

    @JsonCreator
    public Note(@JsonProperty("id") String id,
                @JsonProperty("creator") String creator,
                @JsonProperty("timestamp") long timestamp,
                @JsonProperty("text") String text,
                @JsonProperty("position") Point position,
                @JsonProperty("color") String color) {
        super(id, creator, timestamp);
        this.text = text == null ? "" : text;
        this.position = position;
        this.color = color;
    }

    @Override
    @JsonIgnore
    public ElementType getType() {
        return ElementType.NOTE;
    }

    // Text and timestamp are the only fields that change after creation
    public Note withText(String newText, long newTimestamp) {
        return new Note(getId(), getCreator(), newTimestamp, newText, position, color);
    }

    @Override
    public void validate() {
        super.validate();
        if (position == null) {
            throw new IllegalArgumentException("Note " + getId() + " has no position");
        }
    }
}
