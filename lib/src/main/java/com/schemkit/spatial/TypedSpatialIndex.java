package com.schemkit.spatial;

import java.util.LinkedHashSet;
import java.util.Set;

/** Spatial index over mixed object kinds, with optional filtering by kind on lookup. */
public final class TypedSpatialIndex extends SpatialHashIndex<SpatialEntry> {

    public void insert(BoundingBox box, ObjectKind kind, int index, int layer) {
        insert(box, new SpatialEntry(kind, index, layer));
    }

    public void remove(BoundingBox box, ObjectKind kind, int index, int layer) {
        remove(box, new SpatialEntry(kind, index, layer));
    }

    public Set<SpatialEntry> query(BoundingBox box, ObjectKind kind) {
        return filter(query(box), kind);
    }

    public Set<SpatialEntry> queryPoint(double x, double y, ObjectKind kind) {
        return filter(queryPoint(x, y), kind);
    }

    private static Set<SpatialEntry> filter(Set<SpatialEntry> entries, ObjectKind kind) {
        if (kind == null) {
            return entries;
        }
        Set<SpatialEntry> filtered = new LinkedHashSet<>();
        for (SpatialEntry entry : entries) {
            if (entry.kind() == kind) {
                filtered.add(entry);
            }
        }
        return filtered;
    }
}
