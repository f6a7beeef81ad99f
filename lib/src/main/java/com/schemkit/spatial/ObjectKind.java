package com.schemkit.spatial;

/** Kinds of drawing objects that can share a {@link TypedSpatialIndex}. */
public enum ObjectKind {
    WIRE,
    INSTANCE,
    RECT,
    LINE,
    ARC,
    POLYGON,
    TEXT
}
