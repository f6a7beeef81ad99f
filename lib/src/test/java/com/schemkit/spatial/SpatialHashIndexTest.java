package com.schemkit.spatial;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class SpatialHashIndexTest {

    private static final double PERIOD = SpatialHashIndex.NBOXES * SpatialHashIndex.BOXSIZE;

    @Test
    void queryFindsInsertedKey() {
        SpatialHashIndex<String> index = new SpatialHashIndex<>();
        index.insert(BoundingBox.of(10, 10, 50, 30), "a");
        index.insert(BoundingBox.of(1000, 1000, 1100, 1100), "b");

        assertEquals(Set.of("a"), index.query(BoundingBox.of(0, 0, 20, 20)));
        assertEquals(Set.of("b"), index.queryPoint(1050, 1050));
        assertEquals(2, index.size());
    }

    @Test
    void removedKeyIsNeverReturned() {
        SpatialHashIndex<String> index = new SpatialHashIndex<>();
        BoundingBox box = BoundingBox.of(-250, -250, 900, 120);
        index.insert(box, "wire");
        index.remove(box, "wire");

        assertTrue(index.query(box).isEmpty());
        assertTrue(index.query(BoundingBox.of(-260, -260, -240, -240)).isEmpty());
        assertTrue(index.queryPoint(0, 0).isEmpty());
        assertTrue(index.isEmpty());
    }

    @Test
    void wraparoundAliasesNeverHideCandidates() {
        SpatialHashIndex<String> index = new SpatialHashIndex<>();
        index.insert(BoundingBox.of(100, 100, 120, 120), "near");
        index.insert(BoundingBox.of(100 + PERIOD, 100 - 3 * PERIOD, 120 + PERIOD, 120 - 3 * PERIOD), "far");

        assertEquals(Set.of("near", "far"), index.query(BoundingBox.of(110, 110, 115, 115)));
        assertEquals(
                Set.of("near", "far"),
                index.query(BoundingBox.of(110 + PERIOD, 110 - 3 * PERIOD, 111 + PERIOD, 111 - 3 * PERIOD)));
    }

    @Test
    void negativeCoordinatesMapToValidCells() {
        SpatialHashIndex<Integer> index = new SpatialHashIndex<>();
        index.insert(BoundingBox.of(-1, -1, -1, -1), 7);

        assertEquals(Set.of(7), index.queryPoint(-399, -1));
        assertFalse(index.queryPoint(1, 1).contains(7));
        assertEquals(SpatialHashIndex.NBOXES - 1, SpatialHashIndex.wrap(SpatialHashIndex.cellOf(-1)));
    }

    @Test
    void oversizedBoxesCoverEveryCellOnce() {
        SpatialHashIndex<String> index = new SpatialHashIndex<>();
        BoundingBox huge = BoundingBox.of(-10 * PERIOD, -10 * PERIOD, 10 * PERIOD, 10 * PERIOD);
        index.insert(huge, "huge");

        assertEquals(Set.of("huge"), index.queryPoint(12345, -6789));
        index.remove(huge, "huge");
        assertTrue(index.queryPoint(12345, -6789).isEmpty());
    }

    @Test
    void saturatedCoordinatesStillCoverEveryCell() {
        SpatialHashIndex<String> index = new SpatialHashIndex<>();
        index.insert(BoundingBox.of(0, 0, 1e22, 10), "far");
        index.insert(BoundingBox.of(-5, 0, Double.POSITIVE_INFINITY, 5), "infinite");
        index.insert(BoundingBox.of(Double.NEGATIVE_INFINITY, -1e30, 0, 1e30), "tall");

        assertTrue(index.queryPoint(0, 0).contains("far"));
        assertTrue(index.queryPoint(0, 0).contains("infinite"));
        assertTrue(index.queryPoint(0, 0).contains("tall"));
        assertTrue(index.query(BoundingBox.of(7000, 2, 7001, 3)).contains("infinite"));

        index.remove(BoundingBox.of(0, 0, 1e22, 10), "far");
        assertFalse(index.queryPoint(0, 0).contains("far"));
        assertEquals(2, index.size());
    }

    @Test
    void clearEmptiesAllCells() {
        SpatialHashIndex<String> index = new SpatialHashIndex<>();
        index.insert(BoundingBox.of(0, 0, 10, 10), "a");
        index.insert(BoundingBox.of(500, 500, 510, 510), "b");
        index.clear();

        assertEquals(0, index.size());
        assertTrue(index.query(BoundingBox.of(0, 0, 600, 600)).isEmpty());
    }

    @Test
    void typedIndexFiltersByKind() {
        TypedSpatialIndex index = new TypedSpatialIndex();
        index.insert(BoundingBox.of(0, 0, 10, 10), ObjectKind.WIRE, 0, 0);
        index.insert(BoundingBox.of(5, 5, 15, 15), ObjectKind.RECT, 2, 4);

        Set<SpatialEntry> all = index.query(BoundingBox.of(6, 6, 7, 7), null);
        Set<SpatialEntry> rects = index.query(BoundingBox.of(6, 6, 7, 7), ObjectKind.RECT);

        assertEquals(2, all.size());
        assertEquals(Set.of(new SpatialEntry(ObjectKind.RECT, 2, 4)), rects);

        index.remove(BoundingBox.of(5, 5, 15, 15), ObjectKind.RECT, 2, 4);
        assertTrue(index.queryPoint(6, 6, ObjectKind.RECT).isEmpty());
        assertEquals(Set.of(SpatialEntry.of(ObjectKind.WIRE, 0)), index.queryPoint(6, 6, null));
    }
}
