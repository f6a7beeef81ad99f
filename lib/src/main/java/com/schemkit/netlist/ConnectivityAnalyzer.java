package com.schemkit.netlist;

import com.schemkit.model.Document;
import com.schemkit.model.Instance;
import com.schemkit.model.Symbol;
import com.schemkit.model.Wire;
import com.schemkit.property.PropertyTokens;
import com.schemkit.spatial.BoundingBox;
import com.schemkit.spatial.SpatialHashIndex;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups wires into nets and assigns net names to wires and instance pins.
 *
 * <p>Wires that touch (shared endpoint or T-junction, see {@link WireGeometry}) are merged with a
 * {@link UnionFind}. Names are then applied per group, a later rule overriding an earlier one:
 *
 * <ol>
 *   <li>a label or pin instance ({@code label}, {@code ipin}, {@code opin}, {@code iopin}) names
 *       the group its pin touches, using its {@code lab=} property or its instance label;
 *   <li>a wire's own {@code lab=} property names its group.
 * </ol>
 *
 * <p>Pins of other instances take the name of the first wire group they touch. Groups still unnamed
 * get {@code #net<k>}, with {@code k} counting from 0 in order of each group's lowest wire index.
 * Results are written to {@link Wire#setNode} and {@link Instance#setNode} and also returned.
 *
 * <p>The analyzer never throws for odd input: instances without a symbol or without pins are
 * skipped. Every {@link #analyze} call keeps its state in a fresh run object, so results do not
 * depend on earlier calls. The document must not change while an analysis runs.
 */
public final class ConnectivityAnalyzer {
    private static final Logger LOGGER = Logger.getLogger(ConnectivityAnalyzer.class.getName());
    private static final String PLACEHOLDER_PREFIX = "#wire_group_";

    private final CandidateStrategy strategy;

    public ConnectivityAnalyzer() {
        this(CandidateStrategy.SPATIAL_BUCKETS);
    }

    public ConnectivityAnalyzer(CandidateStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public NetlistResult analyze(Document document) {
        Objects.requireNonNull(document, "document");
        if (document.getWires().isEmpty() && document.getInstances().isEmpty()) {
            return NetlistResult.empty();
        }
        return new AnalysisRun(document).run();
    }

    /** Per-call state: groups, names and the auto-name counter. */
    private final class AnalysisRun {
        private final Document document;
        private final List<Wire> wires;
        private final UnionFind groups;
        private final Map<Integer, String> groupNames = new HashMap<>();
        private final SpatialHashIndex<Integer> wireIndex;
        private int netCounter;

        AnalysisRun(Document document) {
            this.document = document;
            this.wires = document.getWires();
            this.groups = new UnionFind(wires.size());
            this.wireIndex = strategy == CandidateStrategy.SPATIAL_BUCKETS ? buildWireIndex() : null;
        }

        NetlistResult run() {
            LOGGER.log(
                    Level.INFO,
                    "Starting connectivity analysis ({0} wires, {1} instances, {2})",
                    new Object[] {wires.size(), document.getInstances().size(), strategy});
            connectTouchingWires();
            nameGroupsFromLabels();
            nameGroupsFromWireLabels();
            connectInstancePins();
            autoNameGroups();
            for (int i = 0; i < wires.size(); i++) {
                wires.get(i).setNode(groupNames.get(groups.find(i)));
            }
            NetlistResult result = collectNets();
            LOGGER.log(Level.INFO, "Connectivity analysis complete: {0} nets", result.size());
            return result;
        }

        private SpatialHashIndex<Integer> buildWireIndex() {
            SpatialHashIndex<Integer> index = new SpatialHashIndex<>();
            for (int i = 0; i < wires.size(); i++) {
                index.insert(wires.get(i).getBoundingBox(), i);
            }
            return index;
        }

        private void connectTouchingWires() {
            for (int i = 0; i < wires.size(); i++) {
                Wire wire = wires.get(i);
                for (int j : laterCandidates(i)) {
                    if (WireGeometry.touches(wire, wires.get(j))) {
                        groups.union(i, j);
                    }
                }
            }
        }

        /** Indices {@code j > i} worth testing against wire {@code i}, ascending. */
        private List<Integer> laterCandidates(int i) {
            List<Integer> candidates = new ArrayList<>();
            if (wireIndex == null) {
                for (int j = i + 1; j < wires.size(); j++) {
                    candidates.add(j);
                }
                return candidates;
            }
            BoundingBox area = wires.get(i).getBoundingBox().expand(WireGeometry.EPS);
            for (int j : wireIndex.query(area)) {
                if (j > i) {
                    candidates.add(j);
                }
            }
            Collections.sort(candidates);
            return candidates;
        }

        /** Lowest index of a wire touching the point, or -1. */
        private int firstWireAt(double x, double y) {
            if (wireIndex == null) {
                for (int i = 0; i < wires.size(); i++) {
                    if (WireGeometry.pointTouches(x, y, wires.get(i))) {
                        return i;
                    }
                }
                return -1;
            }
            int first = -1;
            BoundingBox area = BoundingBox.ofPoint(x, y).expand(WireGeometry.EPS);
            for (int i : wireIndex.query(area)) {
                if ((first < 0 || i < first) && WireGeometry.pointTouches(x, y, wires.get(i))) {
                    first = i;
                }
            }
            return first;
        }

        private void nameGroupsFromLabels() {
            for (Instance instance : document.getInstances()) {
                Symbol symbol = symbolOf(instance);
                if (symbol == null || !symbol.isPinOrLabel()) {
                    continue;
                }
                String lab = PropertyTokens.getTokValue(instance.getProp(), "lab");
                if (lab.isEmpty()) {
                    lab = instance.getLab();
                }
                if (lab == null || lab.isEmpty()) {
                    continue;
                }
                for (PinGeometry.PinLocation pin : PinGeometry.locate(instance, symbol)) {
                    int wire = firstWireAt(pin.x(), pin.y());
                    if (wire >= 0) {
                        groupNames.put(groups.find(wire), lab);
                    }
                }
            }
        }

        private void nameGroupsFromWireLabels() {
            for (int i = 0; i < wires.size(); i++) {
                String lab = PropertyTokens.getTokValue(wires.get(i).getProp(), "lab");
                if (!lab.isEmpty()) {
                    groupNames.put(groups.find(i), lab);
                }
            }
        }

        private void connectInstancePins() {
            for (Instance instance : document.getInstances()) {
                Symbol symbol = symbolOf(instance);
                if (symbol == null || symbol.isPinOrLabel()) {
                    continue;
                }
                List<PinGeometry.PinLocation> pins = PinGeometry.locate(instance, symbol);
                instance.initNodes(pins.size());
                for (PinGeometry.PinLocation pin : pins) {
                    int wire = firstWireAt(pin.x(), pin.y());
                    if (wire < 0) {
                        continue;
                    }
                    int group = groups.find(wire);
                    String name = groupNames.get(group);
                    instance.setNode(pin.pinIndex(), name != null ? name : PLACEHOLDER_PREFIX + group);
                }
            }
        }

        private void autoNameGroups() {
            for (int i = 0; i < wires.size(); i++) {
                int group = groups.find(i);
                if (!groupNames.containsKey(group)) {
                    groupNames.put(group, "#net" + netCounter++);
                }
            }
            for (Instance instance : document.getInstances()) {
                String[] nodes = instance.getNodes();
                for (int pin = 0; pin < nodes.length; pin++) {
                    String node = nodes[pin];
                    if (node != null && node.startsWith(PLACEHOLDER_PREFIX)) {
                        int group = Integer.parseInt(node.substring(PLACEHOLDER_PREFIX.length()));
                        instance.setNode(pin, groupNames.getOrDefault(group, node));
                    }
                }
            }
        }

        private NetlistResult collectNets() {
            LinkedHashMap<String, List<NetMember>> nets = new LinkedHashMap<>();
            for (int i = 0; i < wires.size(); i++) {
                String node = wires.get(i).getNode();
                if (node != null) {
                    nets.computeIfAbsent(node, key -> new ArrayList<>()).add(NetMember.wire(i));
                }
            }
            List<Instance> instances = document.getInstances();
            for (int i = 0; i < instances.size(); i++) {
                String[] nodes = instances.get(i).getNodes();
                for (int pin = 0; pin < nodes.length; pin++) {
                    if (nodes[pin] != null) {
                        nets.computeIfAbsent(nodes[pin], key -> new ArrayList<>()).add(NetMember.pin(i, pin));
                    }
                }
            }
            return new NetlistResult(nets);
        }

        private Symbol symbolOf(Instance instance) {
            Symbol symbol = document.symbolOf(instance);
            return symbol != null ? symbol : instance.getEmbeddedSymbol();
        }
    }
}
