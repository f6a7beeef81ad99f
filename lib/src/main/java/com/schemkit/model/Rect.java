package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;

/**
 * Box primitive. Boxes on {@link Layers#PIN} inside a symbol are its pins; their {@code name=}
 * token is the pin name.
 */
public final class Rect extends Shape {
    public static final int FLAG_GRAPH = 1;
    public static final int FLAG_IMAGE = 1 << 10;

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;
    private int fill = 1;
    private int ellipseA = -1;
    private int ellipseB = -1;
    private int flags;

    public Rect(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double getX2() {
        return x2;
    }

    public double getY2() {
        return y2;
    }

    /** 0 = no fill, 1 = stipple, 2 = solid. */
    public int getFill() {
        return fill;
    }

    public void setFill(int fill) {
        this.fill = fill;
    }

    public int getEllipseA() {
        return ellipseA;
    }

    public int getEllipseB() {
        return ellipseB;
    }

    public void setEllipse(int a, int b) {
        this.ellipseA = a;
        this.ellipseB = b;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public boolean isGraph() {
        return (flags & FLAG_GRAPH) != 0;
    }

    public boolean isImage() {
        return (flags & FLAG_IMAGE) != 0;
    }

    public double getCenterX() {
        return (x1 + x2) / 2.0;
    }

    public double getCenterY() {
        return (y1 + y2) / 2.0;
    }

    @Override
    public BoundingBox getBoundingBox() {
        return BoundingBox.of(x1, y1, x2, y2);
    }
}
