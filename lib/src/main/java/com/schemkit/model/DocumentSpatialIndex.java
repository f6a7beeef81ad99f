package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;
import com.schemkit.spatial.ObjectKind;
import com.schemkit.spatial.SpatialEntry;
import com.schemkit.spatial.TypedSpatialIndex;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Location lookup over a document snapshot. Grid candidates are filtered with an exact bounding box
 * test, so results contain no aliasing false positives. Rebuild after the document changes.
 */
public final class DocumentSpatialIndex {
    private final TypedSpatialIndex index = new TypedSpatialIndex();
    private final Map<SpatialEntry, BoundingBox> boxes = new HashMap<>();

    private DocumentSpatialIndex() {}

    public static DocumentSpatialIndex build(Document document) {
        DocumentSpatialIndex result = new DocumentSpatialIndex();
        List<Wire> wires = document.getWires();
        for (int i = 0; i < wires.size(); i++) {
            result.put(new SpatialEntry(ObjectKind.WIRE, i, Layers.WIRE), wires.get(i).getBoundingBox());
        }
        List<Instance> instances = document.getInstances();
        for (int i = 0; i < instances.size(); i++) {
            result.put(SpatialEntry.of(ObjectKind.INSTANCE, i), instances.get(i).getBoundingBox());
        }
        List<Text> texts = document.getTexts();
        for (int i = 0; i < texts.size(); i++) {
            Text text = texts.get(i);
            result.put(new SpatialEntry(ObjectKind.TEXT, i, text.getLayer()), text.getBoundingBox());
        }
        document.getRects().forEach((layer, i, rect) ->
                result.put(new SpatialEntry(ObjectKind.RECT, i, layer), rect.getBoundingBox()));
        document.getLines().forEach((layer, i, line) ->
                result.put(new SpatialEntry(ObjectKind.LINE, i, layer), line.getBoundingBox()));
        document.getArcs().forEach((layer, i, arc) ->
                result.put(new SpatialEntry(ObjectKind.ARC, i, layer), arc.getBoundingBox()));
        document.getPolygons().forEach((layer, i, polygon) ->
                result.put(new SpatialEntry(ObjectKind.POLYGON, i, layer), polygon.getBoundingBox()));
        return result;
    }

    private void put(SpatialEntry entry, BoundingBox box) {
        index.insert(box, entry);
        boxes.put(entry, box);
    }

    /** Objects whose bounding box contains the point, in insertion discovery order. */
    public List<SpatialEntry> objectsAt(double x, double y) {
        List<SpatialEntry> hits = new ArrayList<>();
        for (SpatialEntry entry : index.queryPoint(x, y)) {
            if (boxes.get(entry).contains(x, y)) {
                hits.add(entry);
            }
        }
        return hits;
    }

    /** Objects whose bounding box overlaps {@code area}, optionally restricted to one kind. */
    public List<SpatialEntry> objectsIn(BoundingBox area, ObjectKind kind) {
        List<SpatialEntry> hits = new ArrayList<>();
        for (SpatialEntry entry : index.query(area, kind)) {
            if (boxes.get(entry).overlaps(area)) {
                hits.add(entry);
            }
        }
        return hits;
    }

    public List<SpatialEntry> objectsIn(BoundingBox area) {
        return objectsIn(area, null);
    }

    public int size() {
        return index.size();
    }
}
