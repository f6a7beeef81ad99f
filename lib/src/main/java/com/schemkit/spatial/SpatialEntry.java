package com.schemkit.spatial;

import java.util.Objects;

/**
 * Locates one object inside a document: its kind, its index in that kind's collection and, for
 * layered objects, its layer. Non-layered objects use layer 0.
 */
public record SpatialEntry(ObjectKind kind, int index, int layer) {

    public SpatialEntry {
        Objects.requireNonNull(kind, "kind");
    }

    public static SpatialEntry of(ObjectKind kind, int index) {
        return new SpatialEntry(kind, index, 0);
    }
}
