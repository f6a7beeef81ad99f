package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;
import java.util.EnumSet;
import java.util.Set;

/** Text annotation anchored at ({@code x0}, {@code y0}). The content may span several lines. */
public final class Text {
    private String text;
    private final double x0;
    private final double y0;
    private final int rot;
    private final int flip;
    private final double xscale;
    private final double yscale;
    private String prop;
    private int hcenter;
    private int vcenter;
    private int layer = Layers.TEXT;
    private String font;
    private final EnumSet<TextStyle> styles = EnumSet.noneOf(TextStyle.class);
    private int selection = Selection.NONE;

    public Text(String text, double x0, double y0, int rot, int flip, double xscale, double yscale) {
        this.text = text == null ? "" : text;
        this.x0 = x0;
        this.y0 = y0;
        this.rot = rot;
        this.flip = flip;
        this.xscale = xscale;
        this.yscale = yscale;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    public double getX0() {
        return x0;
    }

    public double getY0() {
        return y0;
    }

    public int getRot() {
        return rot;
    }

    public int getFlip() {
        return flip;
    }

    public double getXscale() {
        return xscale;
    }

    public double getYscale() {
        return yscale;
    }

    public String getProp() {
        return prop;
    }

    public void setProp(String prop) {
        this.prop = prop;
    }

    public int getHcenter() {
        return hcenter;
    }

    public void setHcenter(int hcenter) {
        this.hcenter = hcenter;
    }

    public int getVcenter() {
        return vcenter;
    }

    public void setVcenter(int vcenter) {
        this.vcenter = vcenter;
    }

    public int getLayer() {
        return layer;
    }

    public void setLayer(int layer) {
        this.layer = layer;
    }

    public String getFont() {
        return font;
    }

    public void setFont(String font) {
        this.font = font;
    }

    public Set<TextStyle> getStyles() {
        return styles;
    }

    public boolean hasStyle(TextStyle style) {
        return styles.contains(style);
    }

    public int getSelection() {
        return selection;
    }

    public void setSelection(int selection) {
        this.selection = selection;
    }

    /** Anchor point only; text extents depend on fonts. */
    public BoundingBox getBoundingBox() {
        return BoundingBox.ofPoint(x0, y0);
    }
}
