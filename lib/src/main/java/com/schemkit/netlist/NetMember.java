package com.schemkit.netlist;

import java.util.Objects;

/** One member of a net: a wire, or one pin of an instance. */
public record NetMember(Kind kind, int index, int pinIndex) {

    public enum Kind {
        WIRE,
        PIN
    }

    public NetMember {
        Objects.requireNonNull(kind, "kind");
    }

    public static NetMember wire(int wireIndex) {
        return new NetMember(Kind.WIRE, wireIndex, -1);
    }

    public static NetMember pin(int instanceIndex, int pinIndex) {
        return new NetMember(Kind.PIN, instanceIndex, pinIndex);
    }

    @Override
    public String toString() {
        return kind == Kind.WIRE ? "wire " + index : "pin " + index + "." + pinIndex;
    }
}
