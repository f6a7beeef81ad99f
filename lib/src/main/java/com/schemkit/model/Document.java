package com.schemkit.model;

import com.schemkit.Version;
import com.schemkit.spatial.BoundingBox;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory schematic or symbol file: primitives, instances, the symbols they reference and the
 * global property strings.
 *
 * <p>Graphics live in {@link LayeredCollection}s, so writing them back visits layers in ascending
 * order and each layer in insertion order. Symbols are de-duplicated by name.
 */
public final class Document {
    private final List<Wire> wires = new ArrayList<>();
    private final List<Text> texts = new ArrayList<>();
    private final LayeredCollection<Line> lines = new LayeredCollection<>();
    private final LayeredCollection<Rect> rects = new LayeredCollection<>();
    private final LayeredCollection<Arc> arcs = new LayeredCollection<>();
    private final LayeredCollection<Polygon> polygons = new LayeredCollection<>();
    private final List<Instance> instances = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private final Map<String, Integer> symbolIndex = new HashMap<>();

    private String currentName = "";
    private String versionString = "";
    private String fileVersion = Version.FILE_FORMAT_VERSION;

    private String schematicProp;
    private String symbolProp;
    private String vhdlProp;
    private String verilogProp;
    private String tedaxProp;
    private String spectreProp;

    public int addWire(Wire wire) {
        wires.add(Objects.requireNonNull(wire, "wire"));
        return wires.size() - 1;
    }

    public int addText(Text text) {
        texts.add(Objects.requireNonNull(text, "text"));
        return texts.size() - 1;
    }

    public int addLine(int layer, Line line) {
        return lines.add(layer, line);
    }

    public int addRect(int layer, Rect rect) {
        return rects.add(layer, rect);
    }

    public int addArc(int layer, Arc arc) {
        return arcs.add(layer, arc);
    }

    public int addPolygon(int layer, Polygon polygon) {
        return polygons.add(layer, polygon);
    }

    public int addInstance(Instance instance) {
        instances.add(Objects.requireNonNull(instance, "instance"));
        return instances.size() - 1;
    }

    /**
     * Registers a symbol unless one with the same name is already present.
     *
     * @return the index of the registered symbol, or of the existing one with that name
     */
    public int addSymbol(Symbol symbol) {
        Integer existing = symbolIndex.get(symbol.getName());
        if (existing != null) {
            return existing;
        }
        symbols.add(symbol);
        int index = symbols.size() - 1;
        symbolIndex.put(symbol.getName(), index);
        return index;
    }

    public Symbol getSymbol(String name) {
        Integer index = symbolIndex.get(name);
        return index == null ? null : symbols.get(index);
    }

    public int indexOfSymbol(String name) {
        Integer index = symbolIndex.get(name);
        return index == null ? -1 : index;
    }

    /** Resolved symbol of an instance, by index first and then by name; null when unresolved. */
    public Symbol symbolOf(Instance instance) {
        int index = instance.getSymbolIndex();
        if (index >= 0 && index < symbols.size()) {
            return symbols.get(index);
        }
        return getSymbol(instance.getSymbolName());
    }

    public List<Wire> getWires() {
        return Collections.unmodifiableList(wires);
    }

    public List<Text> getTexts() {
        return Collections.unmodifiableList(texts);
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

    public List<Instance> getInstances() {
        return Collections.unmodifiableList(instances);
    }

    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public String getCurrentName() {
        return currentName;
    }

    public void setCurrentName(String currentName) {
        this.currentName = currentName == null ? "" : currentName;
    }

    /** Directory of the file this document was read from, or null when it has none. */
    public Path getDirectory() {
        if (currentName.isEmpty()) {
            return null;
        }
        return Path.of(currentName).toAbsolutePath().getParent();
    }

    public boolean isSymbol() {
        return currentName.endsWith(".sym");
    }

    public String getVersionString() {
        return versionString;
    }

    public void setVersionString(String versionString) {
        this.versionString = versionString == null ? "" : versionString;
    }

    public String getFileVersion() {
        return fileVersion;
    }

    public void setFileVersion(String fileVersion) {
        this.fileVersion = fileVersion;
    }

    /** {@code S} record. */
    public String getSchematicProp() {
        return schematicProp;
    }

    public void setSchematicProp(String schematicProp) {
        this.schematicProp = schematicProp;
    }

    /** {@code K} record. */
    public String getSymbolProp() {
        return symbolProp;
    }

    public void setSymbolProp(String symbolProp) {
        this.symbolProp = symbolProp;
    }

    /** {@code G} record. */
    public String getVhdlProp() {
        return vhdlProp;
    }

    public void setVhdlProp(String vhdlProp) {
        this.vhdlProp = vhdlProp;
    }

    /** {@code V} record. */
    public String getVerilogProp() {
        return verilogProp;
    }

    public void setVerilogProp(String verilogProp) {
        this.verilogProp = verilogProp;
    }

    /** {@code E} record. */
    public String getTedaxProp() {
        return tedaxProp;
    }

    public void setTedaxProp(String tedaxProp) {
        this.tedaxProp = tedaxProp;
    }

    /** {@code F} record. */
    public String getSpectreProp() {
        return spectreProp;
    }

    public void setSpectreProp(String spectreProp) {
        this.spectreProp = spectreProp;
    }

    /** Box around every object, or {@link BoundingBox#EMPTY} for an empty document. */
    public BoundingBox calculateBoundingBox() {
        List<BoundingBox> boxes = new ArrayList<>();
        for (Wire wire : wires) {
            boxes.add(wire.getBoundingBox());
        }
        for (Text text : texts) {
            boxes.add(text.getBoundingBox());
        }
        for (Shape shape : shapes()) {
            boxes.add(shape.getBoundingBox());
        }
        for (Instance instance : instances) {
            boxes.add(instance.getBoundingBox());
        }
        if (boxes.isEmpty()) {
            return BoundingBox.EMPTY;
        }
        BoundingBox box = boxes.get(0);
        for (BoundingBox next : boxes) {
            box = box.union(next);
        }
        return box;
    }

    private List<Shape> shapes() {
        List<Shape> all = new ArrayList<>();
        all.addAll(rects.flatten());
        all.addAll(lines.flatten());
        all.addAll(arcs.flatten());
        all.addAll(polygons.flatten());
        return all;
    }
}
