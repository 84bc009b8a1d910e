package com.sketchsync.model;

public enum ElementType {
    STROKE,
    NOTE
}
