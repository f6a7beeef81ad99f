package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;

/** Common attributes of the purely graphical primitives stored per layer. */
public abstract class Shape {
    private String prop;
    private int dash;
    private double bus = 1.0;
    private int selection = Selection.NONE;

    public String getProp() {
        return prop;
    }

    public void setProp(String prop) {
        this.prop = prop;
    }

    public int getDash() {
        return dash;
    }

    public void setDash(int dash) {
        this.dash = dash;
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

    public abstract BoundingBox getBoundingBox();
}
