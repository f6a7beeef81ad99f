package com.schemkit.model;

/** Drawing layer numbers with a fixed meaning. Layers run from 0 to {@link #COUNT} - 1. */
public final class Layers {
    public static final int BACKGROUND = 0;
    public static final int WIRE = 1;
    public static final int GRID = 2;
    public static final int TEXT = 3;
    public static final int SYMBOL = 4;
    public static final int PIN = 5;
    public static final int SELECTION = 6;
    public static final int PROPERTY = 7;
    public static final int COUNT = 45;

    private Layers() {}

    public static boolean isValid(int layer) {
        return layer >= 0 && layer < COUNT;
    }
}
