package com.schemkit.netlist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Net name to members, in the order nets were first reached: wires by index first, then instance
 * pins.
 */
public final class NetlistResult {
    private static final NetlistResult EMPTY = new NetlistResult(new LinkedHashMap<>());

    private final Map<String, List<NetMember>> nets;

    NetlistResult(LinkedHashMap<String, List<NetMember>> nets) {
        this.nets = Collections.unmodifiableMap(nets);
    }

    static NetlistResult empty() {
        return EMPTY;
    }

    public Map<String, List<NetMember>> getNets() {
        return nets;
    }

    public Set<String> getNetNames() {
        return nets.keySet();
    }

    public List<NetMember> getMembers(String netName) {
        List<NetMember> members = nets.get(netName);
        return members == null ? List.of() : Collections.unmodifiableList(members);
    }

    public int size() {
        return nets.size();
    }

    public boolean isEmpty() {
        return nets.isEmpty();
    }
}
