package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;
import java.util.Arrays;
import java.util.Objects;

/**
 * Placement of a symbol. The symbol is referenced by name and, once resolved, by its index in the
 * owning document's symbol list.
 */
public final class Instance {
    private String symbolName;
    private int symbolIndex = -1;
    private final double x0;
    private final double y0;
    private final int rot;
    private final int flip;
    private String prop;
    private String instanceName;
    private String lab;
    private boolean embed;
    private Symbol embeddedSymbol;
    private String[] nodes;
    private BoundingBox boundingBox;
    private int selection = Selection.NONE;

    public Instance(String symbolName, double x0, double y0, int rot, int flip) {
        this.symbolName = Objects.requireNonNull(symbolName, "symbolName");
        this.x0 = x0;
        this.y0 = y0;
        this.rot = rot;
        this.flip = flip;
        this.boundingBox = BoundingBox.ofPoint(x0, y0);
    }

    public String getSymbolName() {
        return symbolName;
    }

    public void setSymbolName(String symbolName) {
        this.symbolName = Objects.requireNonNull(symbolName, "symbolName");
    }

    /** Index into {@link Document#getSymbols()}, or -1 while unresolved. */
    public int getSymbolIndex() {
        return symbolIndex;
    }

    public void setSymbolIndex(int symbolIndex) {
        this.symbolIndex = symbolIndex;
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

    public String getProp() {
        return prop;
    }

    public void setProp(String prop) {
        this.prop = prop;
    }

    public String getInstanceName() {
        return instanceName;
    }

    public void setInstanceName(String instanceName) {
        this.instanceName = instanceName;
    }

    public String getLab() {
        return lab;
    }

    public void setLab(String lab) {
        this.lab = lab;
    }

    public boolean isEmbed() {
        return embed;
    }

    public void setEmbed(boolean embed) {
        this.embed = embed;
    }

    public Symbol getEmbeddedSymbol() {
        return embeddedSymbol;
    }

    public void setEmbeddedSymbol(Symbol embeddedSymbol) {
        this.embeddedSymbol = embeddedSymbol;
    }

    public int getSelection() {
        return selection;
    }

    public void setSelection(int selection) {
        this.selection = selection;
    }

    /** Allocates an empty net name slot per pin, discarding previous assignments. */
    public void initNodes(int pinCount) {
        nodes = new String[pinCount];
    }

    public boolean hasNodes() {
        return nodes != null;
    }

    public String getNode(int pinIndex) {
        if (nodes == null || pinIndex < 0 || pinIndex >= nodes.length) {
            return null;
        }
        return nodes[pinIndex];
    }

    public void setNode(int pinIndex, String node) {
        if (nodes == null) {
            throw new IllegalStateException("Node array not initialized");
        }
        if (pinIndex >= 0 && pinIndex < nodes.length) {
            nodes[pinIndex] = node;
        }
    }

    public String[] getNodes() {
        return nodes == null ? new String[0] : Arrays.copyOf(nodes, nodes.length);
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    /** Places the symbol's bounding box through this instance's flip, rotation and origin. */
    public void calculateBoundingBox(Symbol symbol) {
        BoundingBox box = symbol.getBoundingBox();
        double sx1 = box.x1();
        double sy1 = box.y1();
        double sx2 = box.x2();
        double sy2 = box.y2();
        if (flip != 0) {
            double t = sx1;
            sx1 = -sx2;
            sx2 = -t;
        }
        double rx1;
        double ry1;
        double rx2;
        double ry2;
        switch (Math.floorMod(rot, 4)) {
            case 1:
                rx1 = -sy2;
                ry1 = sx1;
                rx2 = -sy1;
                ry2 = sx2;
                break;
            case 2:
                rx1 = -sx2;
                ry1 = -sy2;
                rx2 = -sx1;
                ry2 = -sy1;
                break;
            case 3:
                rx1 = sy1;
                ry1 = -sx2;
                rx2 = sy2;
                ry2 = -sx1;
                break;
            default:
                rx1 = sx1;
                ry1 = sy1;
                rx2 = sx2;
                ry2 = sy2;
                break;
        }
        boundingBox = BoundingBox.of(x0 + rx1, y0 + ry1, x0 + rx2, y0 + ry2);
    }
}
