package com.schemkit.loader;

import com.schemkit.model.Arc;
import com.schemkit.model.Document;
import com.schemkit.model.Instance;
import com.schemkit.model.Layers;
import com.schemkit.model.Line;
import com.schemkit.model.Polygon;
import com.schemkit.model.Rect;
import com.schemkit.model.Symbol;
import com.schemkit.model.Text;
import com.schemkit.model.TextStyle;
import com.schemkit.model.Wire;
import com.schemkit.property.PropertyTokens;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Reads schematic ({@code .sch}) and symbol ({@code .sym}) files.
 *
 * <p>The format is a sequence of records, each starting with a one character tag. Free text fields
 * are brace delimited and may contain newlines, so the reader works character by character with one
 * character of pushback rather than line by line. After each record the rest of its line is
 * discarded.
 *
 * <p>Problems are handled at two severities. Unknown tags, records on a layer outside
 * {@code [0, 45)} and stray braces are reported as warnings and skipped. Malformed numbers and a
 * brace string left open at end of input abort the read with a {@link SchematicParseException}.
 *
 * <p>Embedded symbol blocks ({@code [ ... ]} after an instance) are skipped by default. When
 * embedded symbol parsing is enabled they are read into a {@link Symbol} attached to the preceding
 * instance.
 *
 * <p>A reader is not thread safe; {@link #getMessages()} reports the diagnostics of the last read.
 */
public final class SchematicReader {
    private static final Logger LOGGER = Logger.getLogger(SchematicReader.class.getName());

    private static final Pattern FLOAT_PATTERN =
            Pattern.compile(
                    "[+-]?(?:(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?|inf(?:inity)?|nan)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern INT_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final int EOF = -1;

    private final boolean parseEmbeddedSymbols;
    private final List<LoaderMessage> messages = new ArrayList<>();

    public SchematicReader() {
        this(LoaderFlags.isEmbeddedSymbolParsingEnabled());
    }

    public SchematicReader(boolean parseEmbeddedSymbols) {
        this.parseEmbeddedSymbols = parseEmbeddedSymbols;
    }

    public Document read(Path path) throws IOException, SchematicParseException {
        Objects.requireNonNull(path, "path");
        LOGGER.log(Level.INFO, "Reading schematic file {0}", path);
        try (Reader reader =
                new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            return read(reader, path.toString());
        }
    }

    /**
     * Reads a whole document from {@code reader}. The reader is not closed.
     *
     * @param sourceName name used as the document's current name and in diagnostics
     */
    public Document read(Reader reader, String sourceName) throws IOException, SchematicParseException {
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(sourceName, "sourceName");
        messages.clear();
        Document document = new Document();
        document.setCurrentName(sourceName);
        new ReaderState(reader, sourceName).parse(document);
        LOGGER.log(
                Level.INFO,
                "Read complete {0} (wires={1} lines={2} rects={3} arcs={4} polygons={5} texts={6} instances={7})",
                new Object[] {
                    sourceName,
                    document.getWires().size(),
                    document.getLines().size(),
                    document.getRects().size(),
                    document.getArcs().size(),
                    document.getPolygons().size(),
                    document.getTexts().size(),
                    document.getInstances().size()
                });
        return document;
    }

    /** Reads a symbol file and converts it into a {@link Symbol} named after the path. */
    public Symbol readSymbol(Path path) throws IOException, SchematicParseException {
        return Symbol.fromDocument(path.toString(), read(path));
    }

    public List<LoaderMessage> getMessages() {
        return List.copyOf(messages);
    }

    @FunctionalInterface
    private interface RecordHandler {
        void load(Document target) throws IOException, SchematicParseException;
    }

    /** Stream position and per-read settings for one {@code read} call. */
    private final class ReaderState {
        private final PushbackReader in;
        private final String sourceName;
        private final Map<Character, RecordHandler> handlers = new HashMap<>();
        private int lineNumber = 1;
        private int lastChar = '\n';
        private int previousChar = '\n';
        private String fileVersion = "";

        ReaderState(Reader reader, String sourceName) {
            this.in = new PushbackReader(reader, 1);
            this.sourceName = sourceName;
            handlers.put('v', this::loadVersion);
            handlers.put('#', target -> {});
            handlers.put('G', target -> target.setVhdlProp(loadString()));
            handlers.put('K', target -> target.setSymbolProp(loadString()));
            handlers.put('V', target -> target.setVerilogProp(loadString()));
            handlers.put('S', target -> target.setSchematicProp(loadString()));
            handlers.put('E', target -> target.setTedaxProp(loadString()));
            handlers.put('F', target -> target.setSpectreProp(loadString()));
            handlers.put('L', this::loadLine);
            handlers.put('B', this::loadBox);
            handlers.put('A', this::loadArc);
            handlers.put('P', this::loadPolygon);
            handlers.put('T', this::loadText);
            handlers.put('N', this::loadWire);
            handlers.put('C', this::loadInstance);
            handlers.put('[', this::loadEmbeddedBlock);
            handlers.put('{', this::recoverStrayBrace);
        }

        void parse(Document document) throws IOException, SchematicParseException {
            parseRecords(document, false);
        }

        /** @return true if a closing {@code ]} ended a nested block, false at end of input */
        private boolean parseRecords(Document target, boolean nested)
                throws IOException, SchematicParseException {
            while (true) {
                int tag = readTag();
                if (tag == EOF) {
                    return false;
                }
                if (nested && tag == ']') {
                    discardRestOfLine();
                    return true;
                }
                RecordHandler handler = handlers.get((char) tag);
                if (handler == null) {
                    warn("Unknown record tag '" + (char) tag + "'; skipping line");
                } else {
                    handler.load(target);
                }
                discardRestOfLine();
            }
        }

        private void loadVersion(Document target) throws IOException, SchematicParseException {
            String version = loadString();
            if (version == null || version.isEmpty()) {
                return;
            }
            String declared = PropertyTokens.getTokValue(version, "file_version");
            fileVersion = declared.isEmpty() ? "1.0" : declared;
            target.setVersionString(version);
            target.setFileVersion(fileVersion);
            LOGGER.log(Level.FINE, "Version record {0} (file_version={1})", new Object[] {version, fileVersion});
        }

        private void loadLine(Document target) throws IOException, SchematicParseException {
            int layer = readInt();
            double x1 = readDouble();
            double y1 = readDouble();
            double x2 = readDouble();
            double y2 = readDouble();
            String prop = loadString();
            if (!Layers.isValid(layer)) {
                warn("Skipping line on invalid layer " + layer);
                return;
            }
            double ly1;
            double ly2;
            if (x1 == x2) {
                ly1 = Math.min(y1, y2);
                ly2 = Math.max(y1, y2);
            } else if (x1 < x2) {
                ly1 = y1;
                ly2 = y2;
            } else {
                ly1 = y2;
                ly2 = y1;
            }
            Line line = new Line(Math.min(x1, x2), ly1, Math.max(x1, x2), ly2);
            line.setProp(prop);
            line.setDash(dashAttribute(prop));
            line.setBus(busAttribute(prop));
            target.addLine(layer, line);
            LOGGER.log(Level.FINE, "Line on layer {0}", layer);
        }

        private void loadBox(Document target) throws IOException, SchematicParseException {
            int layer = readInt();
            double x1 = readDouble();
            double y1 = readDouble();
            double x2 = readDouble();
            double y2 = readDouble();
            String prop = loadString();
            if (!Layers.isValid(layer)) {
                warn("Skipping box on invalid layer " + layer);
                return;
            }
            Rect rect = new Rect(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
            rect.setProp(prop);
            if (prop != null) {
                String fill = PropertyTokens.getTokValue(prop, "fill");
                if (fill.equals("full")) {
                    rect.setFill(2);
                } else if (fill.equalsIgnoreCase("false")) {
                    rect.setFill(0);
                }
                rect.setDash(dashAttribute(prop));
                rect.setBus(busAttribute(prop));
                String ellipse = PropertyTokens.getTokValue(prop, "ellipse");
                if (!ellipse.isEmpty()) {
                    String[] parts = ellipse.replace(',', ' ').trim().split("\\s+");
                    if (parts.length >= 2) {
                        try {
                            rect.setEllipse(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
                        } catch (NumberFormatException ex) {
                            rect.setEllipse(0, 360);
                        }
                    }
                }
                rect.setFlags(rectFlags(prop));
            }
            target.addRect(layer, rect);
            LOGGER.log(Level.FINE, "Box on layer {0}", layer);
        }

        private void loadArc(Document target) throws IOException, SchematicParseException {
            int layer = readInt();
            double x = readDouble();
            double y = readDouble();
            double r = readDouble();
            double start = readDouble();
            double sweep = readDouble();
            String prop = loadString();
            if (!Layers.isValid(layer)) {
                warn("Skipping arc on invalid layer " + layer);
                return;
            }
            Arc arc = new Arc(x, y, r, start, sweep);
            arc.setProp(prop);
            arc.setFill(openShapeFill(prop));
            arc.setDash(dashAttribute(prop));
            arc.setBus(busAttribute(prop));
            target.addArc(layer, arc);
            LOGGER.log(Level.FINE, "Arc on layer {0}", layer);
        }

        private void loadPolygon(Document target) throws IOException, SchematicParseException {
            int layer = readInt();
            int count = readInt();
            if (count < 0) {
                warn("Skipping polygon with negative point count " + count);
                return;
            }
            Polygon polygon = new Polygon();
            for (int i = 0; i < count; i++) {
                double x = readCoordinate(i, count);
                double y = readCoordinate(i, count);
                polygon.addPoint(x, y);
            }
            String prop = loadString();
            if (!Layers.isValid(layer)) {
                warn("Skipping polygon on invalid layer " + layer);
                return;
            }
            polygon.setProp(prop);
            polygon.setFill(openShapeFill(prop));
            polygon.setDash(dashAttribute(prop));
            polygon.setBus(busAttribute(prop));
            target.addPolygon(layer, polygon);
            LOGGER.log(Level.FINE, "Polygon on layer {0} with {1} points", new Object[] {layer, count});
        }

        private void loadText(Document target) throws IOException, SchematicParseException {
            String content = loadString();
            double x0 = readDouble();
            double y0 = readDouble();
            int rot = readInt();
            int flip = readInt();
            double xscale = readDouble();
            double yscale = readDouble();
            String prop = loadString();
            Text text = new Text(content, x0, y0, rot, flip, xscale, yscale);
            text.setProp(prop);
            if (prop != null) {
                if (PropertyTokens.getTokValue(prop, "hcenter").equalsIgnoreCase("true")) {
                    text.setHcenter(1);
                }
                if (PropertyTokens.getTokValue(prop, "vcenter").equalsIgnoreCase("true")) {
                    text.setVcenter(1);
                }
                text.setLayer(intAttribute(prop, "layer", Layers.TEXT));
                String font = PropertyTokens.getTokValue(prop, "font");
                if (!font.isEmpty()) {
                    text.setFont(font);
                }
                if (PropertyTokens.getTokValue(prop, "weight").equalsIgnoreCase("bold")) {
                    text.getStyles().add(TextStyle.BOLD);
                }
                String slant = PropertyTokens.getTokValue(prop, "slant").toLowerCase(Locale.ROOT);
                if (slant.equals("italic")) {
                    text.getStyles().add(TextStyle.ITALIC);
                } else if (slant.equals("oblique")) {
                    text.getStyles().add(TextStyle.OBLIQUE);
                }
            }
            target.addText(text);
            LOGGER.log(Level.FINE, "Text at ({0}, {1})", new Object[] {x0, y0});
        }

        private void loadWire(Document target) throws IOException, SchematicParseException {
            double x1 = readDouble();
            double y1 = readDouble();
            double x2 = readDouble();
            double y2 = readDouble();
            String prop = loadString();
            Wire wire = new Wire(x1, y1, x2, y2, prop).canonicalize();
            wire.setBus(busAttribute(prop));
            target.addWire(wire);
            LOGGER.log(Level.FINE, "Wire {0}", wire.getBoundingBox());
        }

        private void loadInstance(Document target) throws IOException, SchematicParseException {
            String name = loadString();
            if (name == null || name.isEmpty()) {
                warn("Skipping instance record with empty symbol name");
                return;
            }
            if (fileVersion.equals("1.0") && !name.endsWith(".sym")) {
                name = name + ".sym";
            }
            double x0 = readDouble();
            double y0 = readDouble();
            int rot = readInt();
            int flip = readInt();
            String prop = loadString();
            Instance instance = new Instance(name, x0, y0, rot, flip);
            instance.setProp(prop);
            if (prop != null) {
                String instanceName = PropertyTokens.getTokValue(prop, "name");
                if (!instanceName.isEmpty()) {
                    instance.setInstanceName(instanceName);
                }
                instance.setEmbed(PropertyTokens.getTokValue(prop, "embed").equalsIgnoreCase("true"));
            }
            target.addInstance(instance);
            LOGGER.log(Level.FINE, "Instance of {0} at ({1}, {2})", new Object[] {name, x0, y0});
        }

        private void loadEmbeddedBlock(Document target) throws IOException, SchematicParseException {
            discardRestOfLine();
            if (!parseEmbeddedSymbols) {
                skipEmbeddedBlock();
                return;
            }
            int startLine = lineNumber;
            Document block = new Document();
            boolean closed = parseRecords(block, true);
            if (!closed) {
                warn("Embedded symbol block starting at line " + startLine + " is not closed");
            }
            List<Instance> instances = target.getInstances();
            if (instances.isEmpty()) {
                warn("Embedded symbol block without a preceding instance; ignored");
                return;
            }
            Instance owner = instances.get(instances.size() - 1);
            owner.setEmbeddedSymbol(Symbol.fromDocument(owner.getSymbolName(), block));
            owner.setEmbed(true);
            LOGGER.log(Level.FINE, "Embedded symbol {0} attached", owner.getSymbolName());
        }

        private void skipEmbeddedBlock() throws IOException {
            LOGGER.log(Level.FINE, "Skipping embedded symbol block at line {0}", lineNumber);
            int depth = 1;
            while (depth > 0) {
                String line = readLine();
                if (line == null) {
                    warn("End of input inside embedded symbol block");
                    return;
                }
                String stripped = line.strip();
                if (stripped.startsWith("]")) {
                    depth--;
                } else if (stripped.startsWith("[")) {
                    depth++;
                }
            }
        }

        private void recoverStrayBrace(Document target) throws IOException, SchematicParseException {
            warn("Stray '{' outside a record; reading it as a string");
            unread('{');
            loadString();
        }

        /** Numeric {@code flags=}, or the keywords {@code graph} and {@code image} in any combination. */
        private int rectFlags(String prop) {
            String value = PropertyTokens.getTokValue(prop, "flags");
            if (value.isEmpty() || INT_PATTERN.matcher(value.trim()).matches()) {
                return intAttribute(prop, "flags", 0);
            }
            int flags = 0;
            for (String word : value.split("[\\s,]+")) {
                if (word.equals("graph")) {
                    flags |= Rect.FLAG_GRAPH;
                } else if (word.equals("image")) {
                    flags |= Rect.FLAG_IMAGE;
                } else if (!word.isEmpty()) {
                    warn("Ignoring unknown box flag " + word);
                }
            }
            return flags;
        }

        private int openShapeFill(String prop) {
            if (prop == null) {
                return 0;
            }
            String fill = PropertyTokens.getTokValue(prop, "fill");
            if (fill.equals("full")) {
                return 2;
            }
            return fill.equalsIgnoreCase("true") ? 1 : 0;
        }

        private int dashAttribute(String prop) {
            return Math.max(0, intAttribute(prop, "dash", 0));
        }

        private double busAttribute(String prop) {
            String value = PropertyTokens.getTokValue(prop, "bus");
            if (value.isEmpty()) {
                return 1.0;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException ex) {
                warn("Ignoring non-numeric bus=" + value);
                return 1.0;
            }
        }

        private int intAttribute(String prop, String key, int defaultValue) {
            String value = PropertyTokens.getTokValue(prop, key);
            if (value.isEmpty()) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException ex) {
                warn("Ignoring non-integer " + key + "=" + value);
                return defaultValue;
            }
        }

        private void warn(String text) {
            LOGGER.log(Level.WARNING, "{0}:{1}: {2}", new Object[] {sourceName, String.valueOf(lineNumber), text});
            messages.add(new LoaderMessage(LoaderMessage.Level.WARNING, text, sourceName, lineNumber));
        }

        // Character level input

        private int read() throws IOException {
            int c = in.read();
            previousChar = lastChar;
            lastChar = c;
            if (c == '\n') {
                lineNumber++;
            }
            return c;
        }

        private void unread(int c) throws IOException {
            if (c == EOF) {
                return;
            }
            in.unread(c);
            lastChar = previousChar;
            if (c == '\n') {
                lineNumber--;
            }
        }

        private int readTag() throws IOException {
            int c;
            do {
                c = read();
            } while (c != EOF && Character.isWhitespace(c));
            return c;
        }

        private void discardRestOfLine() throws IOException {
            if (lastChar == '\n' || lastChar == EOF) {
                return;
            }
            int c;
            do {
                c = read();
            } while (c != EOF && c != '\n');
        }

        /** @return the rest of the current line without its newline, or null at end of input */
        private String readLine() throws IOException {
            StringBuilder line = new StringBuilder();
            int c = read();
            if (c == EOF) {
                return null;
            }
            while (c != EOF && c != '\n') {
                line.append((char) c);
                c = read();
            }
            return line.toString();
        }

        private String readToken() throws IOException {
            int c;
            do {
                c = read();
            } while (c != EOF && c != '\n' && Character.isWhitespace(c));
            StringBuilder token = new StringBuilder();
            while (c != EOF && !Character.isWhitespace(c) && c != '{' && c != '}') {
                token.append((char) c);
                c = read();
            }
            unread(c);
            return token.toString();
        }

        private double readDouble() throws IOException, SchematicParseException {
            String token = readToken();
            if (token.isEmpty()) {
                return 0.0;
            }
            if (!FLOAT_PATTERN.matcher(token).matches()) {
                throw new SchematicParseException("Malformed number '" + token + "'", sourceName, lineNumber);
            }
            String lower = token.toLowerCase(Locale.ROOT);
            if (lower.endsWith("nan")) {
                return Double.NaN;
            }
            if (lower.contains("inf")) {
                return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            return Double.parseDouble(token);
        }

        /** Like {@link #readDouble} but a missing value ends the record with an error. */
        private double readCoordinate(int point, int count) throws IOException, SchematicParseException {
            int c;
            do {
                c = read();
            } while (c != EOF && c != '\n' && Character.isWhitespace(c));
            unread(c);
            if (c == EOF || c == '\n' || c == '{' || c == '}') {
                throw new SchematicParseException(
                        "Polygon declares " + count + " points but point " + point + " is missing",
                        sourceName,
                        lineNumber);
            }
            return readDouble();
        }

        private int readInt() throws IOException, SchematicParseException {
            String token = readToken();
            if (token.isEmpty()) {
                return 0;
            }
            if (!INT_PATTERN.matcher(token).matches()) {
                throw new SchematicParseException("Malformed integer '" + token + "'", sourceName, lineNumber);
            }
            try {
                return Integer.parseInt(token);
            } catch (NumberFormatException ex) {
                throw new SchematicParseException("Integer out of range '" + token + "'", sourceName, lineNumber, ex);
            }
        }

        /**
         * Reads a brace delimited string. Everything before the opening brace is skipped; inside,
         * a backslash makes the next character literal and carriage returns are dropped.
         *
         * @return the string, or null for {@code {}} or when input ends before an opening brace; an
         *     empty string is never returned, matching how the writer emits both null and empty
         */
        private String loadString() throws IOException, SchematicParseException {
            int c;
            do {
                c = read();
                if (c == EOF) {
                    return null;
                }
            } while (c != '{');
            int startLine = lineNumber;
            StringBuilder value = new StringBuilder();
            boolean escape = false;
            while (true) {
                c = read();
                if (c == EOF) {
                    throw new SchematicParseException(
                            "End of input inside string opened on line " + startLine + "; missing '}'",
                            sourceName,
                            lineNumber);
                }
                if (c == '\r') {
                    continue;
                }
                if (escape) {
                    value.append((char) c);
                    escape = false;
                } else if (c == '\\') {
                    escape = true;
                } else if (c == '}') {
                    break;
                } else {
                    value.append((char) c);
                }
            }
            return value.length() == 0 ? null : value.toString();
        }
    }
}
