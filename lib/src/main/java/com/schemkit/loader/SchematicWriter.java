package com.schemkit.loader;

import com.schemkit.Version;
import com.schemkit.model.Arc;
import com.schemkit.model.Document;
import com.schemkit.model.Instance;
import com.schemkit.model.LayeredCollection;
import com.schemkit.model.Layers;
import com.schemkit.model.Line;
import com.schemkit.model.Polygon;
import com.schemkit.model.Rect;
import com.schemkit.model.Symbol;
import com.schemkit.model.Text;
import com.schemkit.model.Wire;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes documents and symbols in the record format read by {@link SchematicReader}.
 *
 * <p>Records come out in a fixed order: version, the six global property strings, lines, boxes,
 * arcs, polygons, texts, wires and instances. Layered graphics are written lowest layer first and in
 * insertion order within a layer. Coordinates use 16 significant digits; free text is brace quoted
 * with {@code \}, {@code {} and {@code }} escaped. Lines end with {@code \n} on every platform.
 *
 * <p>A null and an empty string are both written as {@code {}}, which {@link SchematicReader} reads
 * back as null. Property fields therefore come back null where they were empty, while
 * {@link Text} content, which never holds null, comes back as an empty string. Writing the re-read
 * document again produces the same bytes.
 */
public final class SchematicWriter {
    private static final Logger LOGGER = Logger.getLogger(SchematicWriter.class.getName());

    public void write(Document document, Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(document, out);
        }
        LOGGER.log(Level.INFO, "Wrote schematic file {0}", path);
    }

    /** Writes {@code document} to {@code out} without closing it. */
    public void write(Document document, Writer out) throws IOException {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(out, "out");
        String version = document.getVersionString();
        out.write("v ");
        writeString(out, version.isEmpty() ? Version.DEFAULT_VERSION_STRING : version);
        out.write('\n');
        writeStringRecord(out, 'G', document.getVhdlProp());
        writeStringRecord(out, 'K', document.getSymbolProp());
        writeStringRecord(out, 'V', document.getVerilogProp());
        writeStringRecord(out, 'S', document.getSchematicProp());
        writeStringRecord(out, 'E', document.getTedaxProp());
        writeStringRecord(out, 'F', document.getSpectreProp());
        writeGraphics(out, document.getLines(), document.getRects(), document.getArcs(), document.getPolygons());
        writeTexts(out, document.getTexts());
        for (Wire wire : document.getWires()) {
            out.write("N " + num(wire.getX1()) + " " + num(wire.getY1()) + " "
                    + num(wire.getX2()) + " " + num(wire.getY2()) + " ");
            writeString(out, wire.getProp());
            out.write('\n');
        }
        for (Instance instance : document.getInstances()) {
            writeInstance(out, instance);
        }
        out.flush();
    }

    public void writeSymbol(Symbol symbol, Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeSymbol(symbol, out);
        }
        LOGGER.log(Level.INFO, "Wrote symbol file {0}", path);
    }

    /** Writes a standalone symbol file: version, symbol properties, empty globals, then graphics. */
    public void writeSymbol(Symbol symbol, Writer out) throws IOException {
        Objects.requireNonNull(symbol, "symbol");
        out.write("v ");
        writeString(out, Version.DEFAULT_VERSION_STRING);
        out.write('\n');
        writeStringRecord(out, 'K', symbol.getProp());
        out.write("G {}\nV {}\nS {}\nE {}\nF {}\n");
        writeGraphics(out, symbol.getLines(), symbol.getRects(), symbol.getArcs(), symbol.getPolygons());
        writeTexts(out, symbol.getTexts());
        out.flush();
    }

    private void writeInstance(Writer out, Instance instance) throws IOException {
        out.write("C ");
        writeString(out, instance.getSymbolName());
        out.write(" " + num(instance.getX0()) + " " + num(instance.getY0()) + " "
                + instance.getRot() + " " + instance.getFlip() + " ");
        writeString(out, instance.getProp());
        out.write('\n');
        Symbol embedded = instance.getEmbeddedSymbol();
        if (instance.isEmbed() && embedded != null) {
            out.write("[\n");
            writeStringRecord(out, 'K', embedded.getProp());
            writeGraphics(out, embedded.getLines(), embedded.getRects(), embedded.getArcs(), embedded.getPolygons());
            writeTexts(out, embedded.getTexts());
            out.write("]\n");
        }
    }

    private void writeGraphics(
            Writer out,
            LayeredCollection<Line> lines,
            LayeredCollection<Rect> rects,
            LayeredCollection<Arc> arcs,
            LayeredCollection<Polygon> polygons)
            throws IOException {
        for (int layer = 0; layer < Layers.COUNT; layer++) {
            for (Line line : lines.get(layer)) {
                out.write("L " + layer + " " + num(line.getX1()) + " " + num(line.getY1()) + " "
                        + num(line.getX2()) + " " + num(line.getY2()) + " ");
                writeString(out, line.getProp());
                out.write('\n');
            }
        }
        for (int layer = 0; layer < Layers.COUNT; layer++) {
            for (Rect rect : rects.get(layer)) {
                out.write("B " + layer + " " + num(rect.getX1()) + " " + num(rect.getY1()) + " "
                        + num(rect.getX2()) + " " + num(rect.getY2()) + " ");
                writeString(out, rect.getProp());
                out.write('\n');
            }
        }
        for (int layer = 0; layer < Layers.COUNT; layer++) {
            for (Arc arc : arcs.get(layer)) {
                out.write("A " + layer + " " + num(arc.getX()) + " " + num(arc.getY()) + " "
                        + num(arc.getR()) + " " + num(arc.getStartAngle()) + " "
                        + num(arc.getSweepAngle()) + " ");
                writeString(out, arc.getProp());
                out.write('\n');
            }
        }
        for (int layer = 0; layer < Layers.COUNT; layer++) {
            for (Polygon polygon : polygons.get(layer)) {
                StringBuilder record = new StringBuilder();
                record.append("P ").append(layer).append(' ').append(polygon.getPointCount());
                for (Polygon.Point point : polygon.getPoints()) {
                    record.append(' ').append(num(point.x())).append(' ').append(num(point.y()));
                }
                record.append(' ');
                out.write(record.toString());
                writeString(out, polygon.getProp());
                out.write('\n');
            }
        }
    }

    private void writeTexts(Writer out, List<Text> texts) throws IOException {
        for (Text text : texts) {
            out.write("T ");
            writeString(out, text.getText());
            out.write(" " + num(text.getX0()) + " " + num(text.getY0()) + " " + text.getRot() + " "
                    + text.getFlip() + " " + num(text.getXscale()) + " " + num(text.getYscale()) + " ");
            writeString(out, text.getProp());
            out.write('\n');
        }
    }

    private static void writeStringRecord(Writer out, char tag, String value) throws IOException {
        out.write(tag);
        out.write(' ');
        writeString(out, value);
        out.write('\n');
    }

    /** Brace quotes {@code value}; null and empty both become {@code {}}. */
    private static void writeString(Writer out, String value) throws IOException {
        out.write('{');
        if (value != null) {
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '\\' || c == '{' || c == '}') {
                    out.write('\\');
                }
                out.write(c);
            }
        }
        out.write('}');
    }

    private static String num(double value) {
        return NumberFormats.format(value);
    }
}
