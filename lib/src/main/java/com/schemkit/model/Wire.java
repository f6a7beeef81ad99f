package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;

/**
 * Electrical wire segment. The connectivity analyzer fills in {@link #getNode() node} with the name
 * of the net the wire belongs to.
 */
public final class Wire {
    private double x1;
    private double y1;
    private double x2;
    private double y2;
    private String node;
    private String prop;
    private double bus = 1.0;
    private int selection = Selection.NONE;

    public Wire(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public Wire(double x1, double y1, double x2, double y2, String prop) {
        this(x1, y1, x2, y2);
        this.prop = prop;
    }

    /**
     * Swaps the endpoints if needed so that the first one is the smaller by x, then by y.
     *
     * @return this wire
     */
    public Wire canonicalize() {
        if (x1 > x2 || (x1 == x2 && y1 > y2)) {
            double tx = x1;
            double ty = y1;
            x1 = x2;
            y1 = y2;
            x2 = tx;
            y2 = ty;
        }
        return this;
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

    public String getNode() {
        return node;
    }

    public void setNode(String node) {
        this.node = node;
    }

    public String getProp() {
        return prop;
    }

    public void setProp(String prop) {
        this.prop = prop;
    }

    public double getBus() {
        return bus;
    }

    public void setBus(double bus) {
        this.bus = bus;
    }

    public int getSelection() {
        return selection;
    }

    public void setSelection(int selection) {
        this.selection = selection;
    }

    public boolean isHorizontal() {
        return Math.abs(y2 - y1) < 1e-9;
    }

    public boolean isVertical() {
        return Math.abs(x2 - x1) < 1e-9;
    }

    public double length() {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    public BoundingBox getBoundingBox() {
        return BoundingBox.of(x1, y1, x2, y2);
    }
}
