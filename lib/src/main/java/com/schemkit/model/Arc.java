package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;

/** Arc given by center, radius, start angle and sweep, both in degrees. A 360 sweep is a circle. */
public final class Arc extends Shape {
    private final double x;
    private final double y;
    private final double r;
    private final double startAngle;
    private final double sweepAngle;
    private int fill;

    public Arc(double x, double y, double r, double startAngle, double sweepAngle) {
        this.x = x;
        this.y = y;
        this.r = r;
        this.startAngle = startAngle;
        this.sweepAngle = sweepAngle;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getR() {
        return r;
    }

    public double getStartAngle() {
        return startAngle;
    }

    public double getSweepAngle() {
        return sweepAngle;
    }

    public int getFill() {
        return fill;
    }

    public void setFill(int fill) {
        this.fill = fill;
    }

    public boolean isCircle() {
        return Math.abs(sweepAngle) >= 360.0;
    }

    /** Box of the full circle, whatever the sweep. */
    @Override
    public BoundingBox getBoundingBox() {
        return new BoundingBox(x - r, y - r, x + r, y + r);
    }
}
