package com.schemkit.model;

import com.schemkit.property.PropertyTokens;
import com.schemkit.spatial.BoundingBox;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reusable graphical definition placed by {@link Instance}s.
 *
 * <p>The pins are the boxes on {@link Layers#PIN}, in the order they were added; pin {@code i} of
 * an instance always refers to the {@code i}-th such box. Type, template and the netlist format
 * strings are copied out of the global symbol properties when the symbol is built from a document.
 */
public final class Symbol {
    private final String name;
    private final LayeredCollection<Line> lines = new LayeredCollection<>();
    private final LayeredCollection<Rect> rects = new LayeredCollection<>();
    private final LayeredCollection<Arc> arcs = new LayeredCollection<>();
    private final LayeredCollection<Polygon> polygons = new LayeredCollection<>();
    private final List<Text> texts = new ArrayList<>();
    private BoundingBox boundingBox = BoundingBox.EMPTY;
    private String prop;
    private String type;
    private String template;
    private String format;
    private String verilogFormat;
    private String vhdlFormat;
    private String spectreFormat;
    private String tedaxFormat;

    public Symbol(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /** Builds a symbol from a document read out of a symbol file. */
    public static Symbol fromDocument(String name, Document document) {
        Symbol symbol = new Symbol(name);
        symbol.lines.addAll(document.getLines());
        symbol.rects.addAll(document.getRects());
        symbol.arcs.addAll(document.getArcs());
        symbol.polygons.addAll(document.getPolygons());
        symbol.texts.addAll(document.getTexts());
        symbol.setProp(document.getSymbolProp());
        symbol.calculateBoundingBox();
        return symbol;
    }

    public String getName() {
        return name;
    }

    public LayeredCollection<Line> getLines() {
        return lines;
    }

    public LayeredCollection<Rect> getRects() {
        return rects;
    }

    public LayeredCollection<Arc> getArcs() {
        return arcs;
    }

    public LayeredCollection<Polygon> getPolygons() {
        return polygons;
    }

    public List<Text> getTexts() {
        return texts;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public String getProp() {
        return prop;
    }

    /**
     * Sets the global properties and re-derives type, template and the format strings from them. A
     * null or empty {@code prop} clears all derived values to null.
     */
    public void setProp(String prop) {
        this.prop = prop;
        if (prop == null || prop.isEmpty()) {
            type = null;
            template = null;
            format = null;
            verilogFormat = null;
            vhdlFormat = null;
            spectreFormat = null;
            tedaxFormat = null;
            return;
        }
        type = PropertyTokens.getTokValue(prop, "type");
        template = PropertyTokens.getTokValue(prop, "template");
        format = PropertyTokens.getTokValue(prop, "format");
        verilogFormat = PropertyTokens.getTokValue(prop, "verilog_format");
        vhdlFormat = PropertyTokens.getTokValue(prop, "vhdl_format");
        spectreFormat = PropertyTokens.getTokValue(prop, "spectre_format");
        tedaxFormat = PropertyTokens.getTokValue(prop, "tedax_format");
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTemplate() {
        return template;
    }

    public String getFormat() {
        return format;
    }

    public String getVerilogFormat() {
        return verilogFormat;
    }

    public String getVhdlFormat() {
        return vhdlFormat;
    }

    public String getSpectreFormat() {
        return spectreFormat;
    }

    public String getTedaxFormat() {
        return tedaxFormat;
    }

    public List<Rect> getPins() {
        return rects.get(Layers.PIN);
    }

    public int getPinCount() {
        return getPins().size();
    }

    /** Pin names in pin order; a pin without a {@code name=} token gets an empty name. */
    public List<String> getPinNames() {
        List<String> names = new ArrayList<>();
        for (Rect pin : getPins()) {
            names.add(PropertyTokens.getTokValue(pin.getProp(), "name"));
        }
        return names;
    }

    public boolean isPinOrLabel() {
        return SymbolType.isPinOrLabel(type);
    }

    /** Recomputes the bounding box from all graphics; text anchors count as points. */
    public void calculateBoundingBox() {
        List<BoundingBox> boxes = new ArrayList<>();
        lines.forEach((layer, index, line) -> boxes.add(line.getBoundingBox()));
        rects.forEach((layer, index, rect) -> boxes.add(rect.getBoundingBox()));
        arcs.forEach((layer, index, arc) -> boxes.add(arc.getBoundingBox()));
        polygons.forEach((layer, index, polygon) -> {
            if (polygon.getPointCount() > 0) {
                boxes.add(polygon.getBoundingBox());
            }
        });
        for (Text text : texts) {
            boxes.add(text.getBoundingBox());
        }
        if (boxes.isEmpty()) {
            return;
        }
        BoundingBox box = boxes.get(0);
        for (BoundingBox next : boxes) {
            box = box.union(next);
        }
        boundingBox = box;
    }
}
