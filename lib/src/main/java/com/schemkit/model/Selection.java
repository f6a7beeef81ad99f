package com.schemkit.model;

/** Bits of the per-object selection mask. */
public final class Selection {
    public static final int NONE = 0;
    public static final int SELECTED = 1;
    public static final int FIRST_POINT = 1 << 1;
    public static final int SECOND_POINT = 1 << 2;
    public static final int THIRD_POINT = 1 << 3;
    public static final int FOURTH_POINT = 1 << 4;

    private Selection() {}
}
