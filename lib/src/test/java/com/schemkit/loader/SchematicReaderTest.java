package com.schemkit.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

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
import com.schemkit.testing.TestResources;
import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchematicReaderTest {

    private static Document read(String content) throws Exception {
        return new SchematicReader(false).read(new StringReader(content), "test.sch");
    }

    @Test
    void readsGlobalPropertiesAndVersion() throws Exception {
        Document document = read(String.join("\n",
                "v {xschem version=3.4.5 file_version=1.2}",
                "G {vhdl}",
                "K {type=subcircuit}",
                "V {verilog}",
                "S {spice}",
                "E {tedax}",
                "F {spectre}",
                ""));

        assertEquals("xschem version=3.4.5 file_version=1.2", document.getVersionString());
        assertEquals("1.2", document.getFileVersion());
        assertEquals("vhdl", document.getVhdlProp());
        assertEquals("type=subcircuit", document.getSymbolProp());
        assertEquals("verilog", document.getVerilogProp());
        assertEquals("spice", document.getSchematicProp());
        assertEquals("tedax", document.getTedaxProp());
        assertEquals("spectre", document.getSpectreProp());
        assertEquals("test.sch", document.getCurrentName());
    }

    @Test
    void readsGraphicsWithDecodedAttributes() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        Document document = reader.read(new StringReader(String.join("\n",
                "L 4 10 20 0 5 {dash=3}",
                "L 4 0 30 0 -10 {}",
                "B 4 10 10 -10 -10 {fill=false ellipse=0,180 flags=graph}",
                "B 5 -2.5 -2.5 2.5 2.5 {name=p fill=full bus=2}",
                "A 4 0 0 10 45 270 {fill=true}",
                "P 3 3 0 0 10 0 10 10 {fill=full}",
                "")), "graphics.sch");

        Line line = document.getLines().get(4, 0);
        assertEquals(0, line.getX1());
        assertEquals(5, line.getY1());
        assertEquals(10, line.getX2());
        assertEquals(20, line.getY2());
        assertEquals(3, line.getDash());
        Line vertical = document.getLines().get(4, 1);
        assertEquals(-10, vertical.getY1());
        assertEquals(30, vertical.getY2());

        Rect box = document.getRects().get(4, 0);
        assertEquals(-10, box.getX1());
        assertEquals(-10, box.getY1());
        assertEquals(0, box.getFill());
        assertEquals(0, box.getEllipseA());
        assertEquals(180, box.getEllipseB());
        assertTrue(box.isGraph());
        assertFalse(box.isImage());
        Rect pin = document.getRects().get(Layers.PIN, 0);
        assertEquals(2, pin.getFill());
        assertEquals(2.0, pin.getBus());
        assertTrue(reader.getMessages().isEmpty());

        Arc arc = document.getArcs().get(4, 0);
        assertEquals(10, arc.getR());
        assertEquals(270, arc.getSweepAngle());
        assertEquals(1, arc.getFill());

        Polygon polygon = document.getPolygons().get(3, 0);
        assertEquals(3, polygon.getPointCount());
        assertEquals(new Polygon.Point(10, 10), polygon.getPoints().get(2));
        assertEquals(2, polygon.getFill());
    }

    @Test
    void readsTextWireAndInstanceRecords() throws Exception {
        Document document = read(String.join("\n",
                "v {xschem version=3.4.5 file_version=1.2}",
                "T {hello\\{world\\}} 10 20 1 0 0.4 0.5 {layer=8 font=Monospace weight=bold slant=italic hcenter=true}",
                "N 100 0 0 0 {lab=OUT}",
                "C {devices/res.sym} 0 -70 2 1 {name=R1 value=10k}",
                ""));

        Text text = document.getTexts().get(0);
        assertEquals("hello{world}", text.getText());
        assertEquals(1, text.getRot());
        assertEquals(0.5, text.getYscale());
        assertEquals(8, text.getLayer());
        assertEquals("Monospace", text.getFont());
        assertTrue(text.hasStyle(TextStyle.BOLD));
        assertTrue(text.hasStyle(TextStyle.ITALIC));
        assertEquals(1, text.getHcenter());
        assertEquals(0, text.getVcenter());

        Wire wire = document.getWires().get(0);
        assertEquals(0, wire.getX1());
        assertEquals(100, wire.getX2());
        assertEquals("lab=OUT", wire.getProp());

        Instance instance = document.getInstances().get(0);
        assertEquals("devices/res.sym", instance.getSymbolName());
        assertEquals(-70, instance.getY0());
        assertEquals(2, instance.getRot());
        assertEquals(1, instance.getFlip());
        assertEquals("R1", instance.getInstanceName());
        assertFalse(instance.isEmbed());
    }

    @Test
    void textDefaultsToTextLayer() throws Exception {
        Document document = read("T {a} 0 0 0 0 1 1 {}\n");

        assertEquals(Layers.TEXT, document.getTexts().get(0).getLayer());
        assertNull(document.getTexts().get(0).getProp());
    }

    @Test
    void stringsMaySpanLines() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        Document document = reader.read(new StringReader(String.join("\n",
                "K {type=label",
                "format=\"@lab\"}",
                "Q unknown",
                "")), "multi.sym");

        assertEquals("type=label\nformat=\"@lab\"", document.getSymbolProp());
        assertEquals(1, reader.getMessages().size());
        assertEquals(3, reader.getMessages().get(0).getSourceLineno());
    }

    @Test
    void legacyFilesAppendSymbolExtension() throws Exception {
        Document document = read(String.join("\n",
                "v {xschem version=1.0}",
                "C {devices/res} 0 0 0 0 {name=R1}",
                "C {devices/cap.sym} 0 0 0 0 {name=C1}",
                ""));

        assertEquals("1.0", document.getFileVersion());
        assertEquals("devices/res.sym", document.getInstances().get(0).getSymbolName());
        assertEquals("devices/cap.sym", document.getInstances().get(1).getSymbolName());
    }

    @Test
    void unknownTagsAndInvalidLayersWarnAndContinue() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        Document document = reader.read(new StringReader(String.join("\n",
                "X something odd",
                "L 99 0 0 10 10 {dash=1}",
                "B 4 0 0 10 10 {}",
                "")), "warn.sch");

        assertEquals(0, document.getLines().size());
        assertEquals(1, document.getRects().size());
        List<LoaderMessage> messages = reader.getMessages();
        assertEquals(2, messages.size());
        assertEquals(LoaderMessage.Level.WARNING, messages.get(0).getLevel());
        assertEquals(1, messages.get(0).getSourceLineno());
        assertEquals("warn.sch", messages.get(1).getSourceFilename());
        assertTrue(messages.get(1).getMessage().contains("99"));
    }

    @Test
    void emptyInstanceNameIsSkipped() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        Document document = reader.read(new StringReader("C {} 0 0 0 0 {}\nN 0 0 1 0 {}\n"), "empty.sch");

        assertEquals(0, document.getInstances().size());
        assertEquals(1, document.getWires().size());
        assertEquals(1, reader.getMessages().size());
    }

    @Test
    void strayBraceIsReportedAndSkipped() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        Document document = reader.read(new StringReader("{junk} 1 2\nN 0 0 10 0 {}\n"), "stray.sch");

        assertEquals(1, document.getWires().size());
        assertEquals(1, reader.getMessages().size());
    }

    @Test
    void malformedNumberAbortsWithLine() {
        SchematicParseException ex = assertThrows(
                SchematicParseException.class,
                () -> read("N 0 0 10 0 {}\nN 0 abc 10 0 {}\n"));

        assertEquals(2, ex.getLineNumber());
        assertEquals("test.sch", ex.getSourceName());
        assertTrue(ex.getMessage().startsWith("test.sch:2: "));
    }

    @Test
    void invalidLayerRecordConsumesMultiLineProperty() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        Document document = reader.read(new StringReader(String.join("\n",
                "B 77 0 0 10 10 {name=x",
                "N 0 0 5 0 {lab=FAKE}",
                "C {fake.sym} 0 0 0 0 {}}",
                "N 0 0 10 0 {lab=REAL}",
                "")), "layer.sch");

        assertEquals(0, document.getRects().size());
        assertEquals(0, document.getInstances().size());
        assertEquals(1, document.getWires().size());
        assertEquals("lab=REAL", document.getWires().get(0).getProp());
        assertEquals(1, reader.getMessages().size());
        assertTrue(reader.getMessages().get(0).getMessage().contains("77"));
    }

    @Test
    void linesAndWiresAreOrderedByX() throws Exception {
        Document document = read(String.join("\n",
                "L 4 50 -5 -20 30 {}",
                "N 40 7 10 -3 {}",
                ""));

        Line line = document.getLines().get(4, 0);
        assertEquals(-20, line.getX1());
        assertEquals(30, line.getY1());
        assertEquals(50, line.getX2());
        assertEquals(-5, line.getY2());
        Wire wire = document.getWires().get(0);
        assertEquals(10, wire.getX1());
        assertEquals(-3, wire.getY1());
        assertEquals(40, wire.getX2());
        assertEquals(7, wire.getY2());
    }

    @Test
    void polygonWithMissingPointsAborts() {
        SchematicParseException huge = assertThrows(
                SchematicParseException.class,
                () -> read("P 4 2000000000 {}\n"));
        SchematicParseException shortRecord = assertThrows(
                SchematicParseException.class,
                () -> read("N 0 0 1 0 {}\nP 4 3 0 0 10 0\nN 0 0 5 0 {}\n"));

        assertTrue(huge.getMessage().contains("point 0 is missing"));
        assertEquals(2, shortRecord.getLineNumber());
        assertTrue(shortRecord.getMessage().contains("point 2 is missing"));
    }

    @Test
    void unterminatedStringAborts() {
        SchematicParseException ex = assertThrows(
                SchematicParseException.class,
                () -> read("S {never closed\nN 0 0 1 1\n"));

        assertTrue(ex.getMessage().contains("missing '}'"));
    }

    @Test
    void embeddedBlocksAreSkippedByDefault() throws Exception {
        Document document = read(String.join("\n",
                "C {res.sym} 0 0 0 0 {name=R1 embed=true}",
                "[",
                "K {type=primitive}",
                "B 5 -2.5 -2.5 2.5 2.5 {name=P}",
                "]",
                "N 0 0 10 0 {}",
                ""));

        Instance instance = document.getInstances().get(0);
        assertTrue(instance.isEmbed());
        assertNull(instance.getEmbeddedSymbol());
        assertEquals(0, document.getRects().size());
        assertEquals(1, document.getWires().size());
    }

    @Test
    void embeddedBlocksAreAttachedWhenEnabled() throws Exception {
        Document document = new SchematicReader(true).read(new StringReader(String.join("\n",
                "C {res.sym} 0 0 0 0 {name=R1 embed=true}",
                "[",
                "v {xschem version=3.4.5 file_version=1.2}",
                "K {type=primitive}",
                "B 5 -2.5 -2.5 2.5 2.5 {name=P}",
                "]",
                "N 0 0 10 0 {}",
                "")), "embed.sch");

        Symbol symbol = document.getInstances().get(0).getEmbeddedSymbol();
        assertNotNull(symbol);
        assertEquals("res.sym", symbol.getName());
        assertEquals("primitive", symbol.getType());
        assertEquals(List.of("P"), symbol.getPinNames());
        assertEquals(0, document.getRects().size());
        assertEquals(1, document.getWires().size());
    }

    @Test
    void unclosedEmbeddedBlockWarnsAtEndOfInput() throws Exception {
        SchematicReader reader = new SchematicReader(false);
        reader.read(new StringReader("C {res.sym} 0 0 0 0 {}\n[\nK {type=primitive}\n"), "open.sch");

        assertEquals(1, reader.getMessages().size());
    }

    @Test
    void readsSymbolFile() throws Exception {
        Document document = read(TestResources.read("schematics/res.sym"));
        Symbol symbol = Symbol.fromDocument("res.sym", document);

        assertEquals("primitive", symbol.getType());
        assertEquals("@name @pinlist @value", symbol.getFormat());
        assertEquals(List.of("P", "M"), symbol.getPinNames());
        assertEquals(2, symbol.getLines().size());
        assertEquals(1, symbol.getTexts().size());
    }
}
