package com.schemkit.spatial;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Uniform grid index answering "which keys may overlap this box" questions.
 *
 * <p>The grid has {@link #NBOXES} x {@link #NBOXES} cells of {@link #BOXSIZE} units and wraps
 * around in both directions: a world coordinate lands in cell {@code floor(c / BOXSIZE) mod
 * NBOXES}. Memory stays bounded for any drawing extent, at the price of far apart objects sharing
 * cells. Queries therefore return candidates that can be false positives but never miss a key whose
 * box overlaps the query; callers run an exact test on what comes back.
 *
 * @param <T> key type; keys are compared with {@code equals}
 */
public class SpatialHashIndex<T> {

    public static final int NBOXES = 50;
    public static final double BOXSIZE = 400.0;

    private final List<List<Set<T>>> cells = new ArrayList<>(NBOXES);
    private int size;

    public SpatialHashIndex() {
        for (int i = 0; i < NBOXES; i++) {
            List<Set<T>> column = new ArrayList<>(NBOXES);
            for (int j = 0; j < NBOXES; j++) {
                column.add(new LinkedHashSet<>());
            }
            cells.add(column);
        }
    }

    public void insert(BoundingBox box, T key) {
        Objects.requireNonNull(key, "key");
        CellRange range = CellRange.of(box);
        for (int i = 0; i < range.columns(); i++) {
            for (int j = 0; j < range.rows(); j++) {
                range.cell(cells, i, j).add(key);
            }
        }
        size++;
    }

    /**
     * Unregisters {@code key} from every cell covered by {@code box}. The box must be the one the
     * key was inserted with, otherwise stale cell entries remain.
     */
    public void remove(BoundingBox box, T key) {
        CellRange range = CellRange.of(box);
        boolean removed = false;
        for (int i = 0; i < range.columns(); i++) {
            for (int j = 0; j < range.rows(); j++) {
                removed |= range.cell(cells, i, j).remove(key);
            }
        }
        if (removed) {
            size--;
        }
    }

    /** Candidate keys whose cells overlap {@code box}, each reported once, in discovery order. */
    public Set<T> query(BoundingBox box) {
        Set<T> found = new LinkedHashSet<>();
        CellRange range = CellRange.of(box);
        for (int i = 0; i < range.columns(); i++) {
            for (int j = 0; j < range.rows(); j++) {
                found.addAll(range.cell(cells, i, j));
            }
        }
        return found;
    }

    public Set<T> queryPoint(double x, double y) {
        return new LinkedHashSet<>(cells.get(wrap(cellOf(x))).get(wrap(cellOf(y))));
    }

    public void clear() {
        for (List<Set<T>> column : cells) {
            for (Set<T> cell : column) {
                cell.clear();
            }
        }
        size = 0;
    }

    /** Number of successful inserts not yet removed. */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    static long cellOf(double coordinate) {
        return (long) Math.floor(coordinate / BOXSIZE);
    }

    static int wrap(long cell) {
        return (int) Math.floorMod(cell, (long) NBOXES);
    }

    private static final class CellRange {
        final long firstColumn;
        final long firstRow;
        final long lastColumn;
        final long lastRow;

        private CellRange(long firstColumn, long firstRow, long lastColumn, long lastRow) {
            this.firstColumn = firstColumn;
            this.firstRow = firstRow;
            this.lastColumn = lastColumn;
            this.lastRow = lastRow;
        }

        static CellRange of(BoundingBox box) {
            Objects.requireNonNull(box, "box");
            return new CellRange(cellOf(box.x1()), cellOf(box.y1()), cellOf(box.x2()), cellOf(box.y2()));
        }

        int columns() {
            return span(firstColumn, lastColumn);
        }

        int rows() {
            return span(firstRow, lastRow);
        }

        /** Cell {@code (i, j)} of the range, wrapped without overflowing near saturated bounds. */
        <T> Set<T> cell(List<List<Set<T>>> cells, int i, int j) {
            return cells.get((wrap(firstColumn) + i) % NBOXES).get((wrap(firstRow) + j) % NBOXES);
        }

        // Capped at NBOXES: wider spans would only revisit wrapped cells. A negative difference means
        // the subtraction overflowed, which also covers the whole grid.
        private static int span(long first, long last) {
            long difference = last - first;
            return difference < 0 || difference >= NBOXES - 1 ? NBOXES : (int) difference + 1;
        }
    }
}
