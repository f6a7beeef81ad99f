package com.schemkit.spatial;

/**
 * Axis aligned box with {@code x1 <= x2} and {@code y1 <= y2}. The factory normalizes corner order,
 * so callers can pass the two corners in any order.
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

    public static final BoundingBox EMPTY = new BoundingBox(0.0, 0.0, 0.0, 0.0);

    public static BoundingBox of(double xa, double ya, double xb, double yb) {
        return new BoundingBox(Math.min(xa, xb), Math.min(ya, yb), Math.max(xa, xb), Math.max(ya, yb));
    }

    public static BoundingBox ofPoint(double x, double y) {
        return new BoundingBox(x, y, x, y);
    }

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }

    public boolean overlaps(BoundingBox other) {
        return x1 <= other.x2 && x2 >= other.x1 && y1 <= other.y2 && y2 >= other.y1;
    }

    public boolean contains(double x, double y) {
        return x1 <= x && x <= x2 && y1 <= y && y <= y2;
    }

    public BoundingBox expand(double pad) {
        return new BoundingBox(x1 - pad, y1 - pad, x2 + pad, y2 + pad);
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
                Math.min(x1, other.x1),
                Math.min(y1, other.y1),
                Math.max(x2, other.x2),
                Math.max(y2, other.y2));
    }
}
