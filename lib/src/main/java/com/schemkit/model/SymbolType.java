package com.schemkit.model;

import java.util.Set;

/** Values of the {@code type=} token in a symbol's global properties. */
public final class SymbolType {
    public static final String SUBCIRCUIT = "subcircuit";
    public static final String PRIMITIVE = "primitive";
    public static final String LABEL = "label";
    public static final String IPIN = "ipin";
    public static final String OPIN = "opin";
    public static final String IOPIN = "iopin";
    public static final String NETLIST_COMMANDS = "netlist_commands";
    public static final String NOCONN = "noconn";
    public static final String PROBE = "probe";
    public static final String BUS_TAP = "bus_tap";
    public static final String LAUNCHER = "launcher";

    private static final Set<String> PIN_OR_LABEL = Set.of(LABEL, IPIN, OPIN, IOPIN);

    private SymbolType() {}

    /** True for the types whose instances name the net they touch. */
    public static boolean isPinOrLabel(String type) {
        return type != null && PIN_OR_LABEL.contains(type);
    }
}
