package com.schemkit.netlist;

/** How the analyzer picks wire pairs (and wires near pins) for exact contact tests. */
public enum CandidateStrategy {
    /** Every pair; quadratic in the number of wires. */
    ALL_PAIRS,
    /** Only wires whose padded boxes share a spatial hash cell. Produces the same nets. */
    SPATIAL_BUCKETS
}
