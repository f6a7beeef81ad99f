package com.schemkit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-layer lists of objects. Insertion order inside a layer is kept, and layers are always visited
 * in ascending order.
 */
public final class LayeredCollection<T> {

    @FunctionalInterface
    public interface LayerVisitor<T> {
        void visit(int layer, int index, T item);
    }

    private final List<List<T>> layers;

    public LayeredCollection() {
        layers = new ArrayList<>(Layers.COUNT);
        for (int i = 0; i < Layers.COUNT; i++) {
            layers.add(new ArrayList<>());
        }
    }

    /**
     * Appends {@code item} to {@code layer}.
     *
     * @return the item's index inside its layer
     * @throws IllegalArgumentException if the layer is outside {@code [0, Layers.COUNT)}
     */
    public int add(int layer, T item) {
        Objects.requireNonNull(item, "item");
        List<T> items = layerList(layer);
        items.add(item);
        return items.size() - 1;
    }

    public List<T> get(int layer) {
        return Collections.unmodifiableList(layerList(layer));
    }

    public T get(int layer, int index) {
        return layerList(layer).get(index);
    }

    public boolean remove(int layer, T item) {
        return layerList(layer).remove(item);
    }

    public int size() {
        int total = 0;
        for (List<T> items : layers) {
            total += items.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void forEach(LayerVisitor<? super T> visitor) {
        for (int layer = 0; layer < layers.size(); layer++) {
            List<T> items = layers.get(layer);
            for (int i = 0; i < items.size(); i++) {
                visitor.visit(layer, i, items.get(i));
            }
        }
    }

    /** All items, lowest layer first. */
    public List<T> flatten() {
        List<T> all = new ArrayList<>();
        for (List<T> items : layers) {
            all.addAll(items);
        }
        return all;
    }

    public void addAll(LayeredCollection<? extends T> other) {
        for (int layer = 0; layer < Layers.COUNT; layer++) {
            layers.get(layer).addAll(other.layers.get(layer));
        }
    }

    public void clear() {
        for (List<T> items : layers) {
            items.clear();
        }
    }

    private List<T> layerList(int layer) {
        if (!Layers.isValid(layer)) {
            throw new IllegalArgumentException("Layer out of range: " + layer);
        }
        return layers.get(layer);
    }
}
