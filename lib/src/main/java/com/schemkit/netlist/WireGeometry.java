package com.schemkit.netlist;

import com.schemkit.model.Wire;

/** Tolerant contact tests between wires and points. */
public final class WireGeometry {
    /** Matching tolerance in drawing units. */
    public static final double EPS = 0.5;

    private WireGeometry() {}

    /**
     * True if the wires share an endpoint within {@link #EPS} on both axes, or an endpoint of one
     * lies on the other (a T-junction).
     */
    public static boolean touches(Wire a, Wire b) {
        if (close(a.getX1(), a.getY1(), b.getX1(), b.getY1())
                || close(a.getX1(), a.getY1(), b.getX2(), b.getY2())
                || close(a.getX2(), a.getY2(), b.getX1(), b.getY1())
                || close(a.getX2(), a.getY2(), b.getX2(), b.getY2())) {
            return true;
        }
        return pointOnWire(a.getX1(), a.getY1(), b)
                || pointOnWire(a.getX2(), a.getY2(), b)
                || pointOnWire(b.getX1(), b.getY1(), a)
                || pointOnWire(b.getX2(), b.getY2(), a);
    }

    /**
     * Collinearity test with the cross product scaled by the wire's larger extent, followed by an
     * {@link #EPS} padded bounding box check.
     */
    public static boolean pointOnWire(double px, double py, Wire wire) {
        double x1 = wire.getX1();
        double y1 = wire.getY1();
        double x2 = wire.getX2();
        double y2 = wire.getY2();
        double cross = (px - x1) * (y2 - y1) - (py - y1) * (x2 - x1);
        double scale = Math.max(Math.max(Math.abs(x2 - x1), Math.abs(y2 - y1)), 1.0);
        if (Math.abs(cross) > EPS * scale) {
            return false;
        }
        return Math.min(x1, x2) - EPS <= px && px <= Math.max(x1, x2) + EPS
                && Math.min(y1, y2) - EPS <= py && py <= Math.max(y1, y2) + EPS;
    }

    /** Contact test used for pins: on the segment or at either endpoint. */
    public static boolean pointTouches(double px, double py, Wire wire) {
        return pointOnWire(px, py, wire)
                || close(px, py, wire.getX1(), wire.getY1())
                || close(px, py, wire.getX2(), wire.getY2());
    }

    private static boolean close(double ax, double ay, double bx, double by) {
        return Math.abs(ax - bx) < EPS && Math.abs(ay - by) < EPS;
    }
}
