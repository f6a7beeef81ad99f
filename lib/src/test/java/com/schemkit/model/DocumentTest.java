package com.schemkit.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.schemkit.spatial.BoundingBox;
import com.schemkit.spatial.ObjectKind;
import com.schemkit.spatial.SpatialEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTest {

    @Test
    void symbolsAreDeduplicatedByName() {
        Document document = new Document();
        Symbol first = new Symbol("res.sym");

        assertEquals(0, document.addSymbol(first));
        assertEquals(1, document.addSymbol(new Symbol("cap.sym")));
        assertEquals(0, document.addSymbol(new Symbol("res.sym")));
        assertSame(first, document.getSymbol("res.sym"));
        assertEquals(2, document.getSymbols().size());
        assertNull(document.getSymbol("ind.sym"));
    }

    @Test
    void symbolOfPrefersResolvedIndex() {
        Document document = new Document();
        document.addSymbol(new Symbol("a.sym"));
        Symbol b = new Symbol("b.sym");
        document.addSymbol(b);
        Instance byIndex = new Instance("a.sym", 0, 0, 0, 0);
        byIndex.setSymbolIndex(1);
        Instance byName = new Instance("b.sym", 0, 0, 0, 0);

        assertSame(b, document.symbolOf(byIndex));
        assertSame(b, document.symbolOf(byName));
        assertNull(document.symbolOf(new Instance("c.sym", 0, 0, 0, 0)));
    }

    @Test
    void layeredCollectionsKeepInsertionOrderPerLayer() {
        LayeredCollection<String> collection = new LayeredCollection<>();
        collection.add(7, "late");
        collection.add(2, "first");
        collection.add(2, "second");

        StringBuilder order = new StringBuilder();
        collection.forEach((layer, index, item) -> order.append(layer).append(':').append(item).append(' '));

        assertEquals("2:first 2:second 7:late ", order.toString());
        assertEquals(List.of("first", "second", "late"), collection.flatten());
        assertThrows(IllegalArgumentException.class, () -> collection.add(Layers.COUNT, "x"));
        assertThrows(IllegalArgumentException.class, () -> collection.add(-1, "x"));
    }

    @Test
    void boundingBoxCoversAllObjects() {
        Document document = new Document();
        assertEquals(BoundingBox.EMPTY, document.calculateBoundingBox());

        document.addWire(new Wire(0, 0, 100, 0));
        document.addArc(4, new Arc(50, 50, 10, 0, 360));
        document.addText(new Text("t", -30, 5, 0, 0, 1, 1));

        assertEquals(new BoundingBox(-30, 0, 100, 60), document.calculateBoundingBox());
    }

    @Test
    void spatialIndexReturnsOnlyExactHits() {
        Document document = new Document();
        document.addWire(new Wire(0, 0, 100, 0));
        document.addWire(new Wire(20000, 0, 20100, 0));
        document.addRect(Layers.SYMBOL, new Rect(40, -10, 60, 10));

        DocumentSpatialIndex index = DocumentSpatialIndex.build(document);

        assertEquals(
                List.of(new SpatialEntry(ObjectKind.WIRE, 0, Layers.WIRE),
                        new SpatialEntry(ObjectKind.RECT, 0, Layers.SYMBOL)),
                index.objectsAt(50, 0));
        assertEquals(
                List.of(new SpatialEntry(ObjectKind.WIRE, 1, Layers.WIRE)),
                index.objectsIn(BoundingBox.of(20050, -1, 20060, 1), ObjectKind.WIRE));
        assertEquals(3, index.size());
    }
}
