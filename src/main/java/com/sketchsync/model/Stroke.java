package com.sketchsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class Stroke extends CanvasElement {
    private final List<Point> points;
    private final String color;
    private final int width;

    @JsonCreator
    public Stroke(@JsonProperty("id") String id,
                  @JsonProperty("creator") String creator,
                  @JsonProperty("timestamp") long timestamp,
                  @JsonProperty("points") List<Point> points,
                  @JsonProperty("color") String color,
                  @JsonProperty("width") int width) {
        super(id, creator, timestamp);
        this.points = points == null ? List.of() : List.copyOf(points);
        this.color = color;
        this.width = width;
    }

    @Override
    @JsonIgnore
    public ElementType getType() {
        return ElementType.STROKE;
    }

    @Override
    public void validate() {
        super.validate();
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Stroke " + getId() + " needs at least one point");
        }
        if (width <= 0) {
            throw new IllegalArgumentException("Stroke " + getId() + " has non-positive width " + width);
        }
    }
}
