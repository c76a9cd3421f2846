package io.github.drompincen.durableagent.runtime.graph;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated workflow graph. Built once through {@link #builder(String)}; every node has
 * exactly one outgoing edge (static or conditional), every edge target is a known node or
 * {@link #END}, and every node is reachable from the start node.
 */
public final class GraphDefinition {

    public static final String END = "__end__";
    public static final int DEFAULT_MAX_STEPS = 50;

    private final String name;
    private final Map<String, NodeSpec> nodes;
    private final Map<String, Edge> edges;
    private final String startNode;
    private final Set<String> interruptBefore;
    private final ResolutionPolicy resolutionPolicy;
    private final int maxSteps;

    private GraphDefinition(Builder b) {
        this.name = b.name;
        this.nodes = Map.copyOf(b.nodes);
        this.edges = Map.copyOf(b.edges);
        this.startNode = b.startNode;
        this.interruptBefore = Set.copyOf(b.interruptBefore);
        this.resolutionPolicy = b.resolutionPolicy;
        this.maxSteps = b.maxSteps;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }
    public String startNode() { return startNode; }
    public Set<String> interruptBefore() { return interruptBefore; }
    public ResolutionPolicy resolutionPolicy() { return resolutionPolicy; }
    public int maxSteps() { return maxSteps; }
    public Collection<String> nodeNames() { return nodes.keySet(); }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    public NodeSpec node(String nodeName) {
        NodeSpec spec = nodes.get(nodeName);
        if (spec == null) {
            throw new GraphConfigurationException("Unknown node '" + nodeName + "' in graph " + name);
        }
        return spec;
    }

    /**
     * Successor of {@code from} for the given state. Static edges return their target; conditional
     * edges map the router outcome through the path map.
     */
    public String resolveNext(String from, WorkflowState state) {
        Edge edge = edges.get(from);
        if (edge == null) {
            throw new GraphConfigurationException("Node '" + from + "' has no outgoing edge");
        }
        if (edge.target != null) {
            return edge.target;
        }
        String outcome = edge.router.route(state);
        String target = outcome == null ? null : edge.pathMap.get(outcome);
        if (target == null) {
            throw new GraphConfigurationException("Router of node '" + from + "' returned unmapped outcome '"
                    + outcome + "', permitted: " + edge.pathMap.keySet());
        }
        return target;
    }

    private static final class Edge {
        final String target;
        final EdgeRouter router;
        final Map<String, String> pathMap;

        Edge(String target, EdgeRouter router, Map<String, String> pathMap) {
            this.target = target;
            this.router = router;
            this.pathMap = pathMap;
        }

        Collection<String> targets() {
            return target != null ? Set.of(target) : pathMap.values();
        }
    }

    public static final class Builder {

        private final String name;
        private final Map<String, NodeSpec> nodes = new LinkedHashMap<>();
        private final Map<String, Edge> edges = new LinkedHashMap<>();
        private final Set<String> interruptBefore = new LinkedHashSet<>();
        private final Set<String> duplicates = new LinkedHashSet<>();
        private String startNode;
        private ResolutionPolicy resolutionPolicy = ResolutionPolicy.ALWAYS_RESOLVED;
        private int maxSteps = DEFAULT_MAX_STEPS;

        private Builder(String name) {
            this.name = name;
        }

        public Builder node(String nodeName, NodeFunction function, StateField... ownedFields) {
            if (END.equals(nodeName)) {
                throw new GraphConfigurationException("'" + END + "' is reserved");
            }
            Set<StateField> owned = ownedFields.length == 0
                    ? EnumSet.noneOf(StateField.class)
                    : EnumSet.copyOf(Arrays.asList(ownedFields));
            if (nodes.put(nodeName, new NodeSpec(nodeName, function, owned)) != null) {
                duplicates.add(nodeName);
            }
            return this;
        }

        public Builder edge(String from, String to) {
            putEdge(from, new Edge(to, null, null));
            return this;
        }

        public Builder conditionalEdge(String from, EdgeRouter router, Map<String, String> pathMap) {
            if (pathMap.isEmpty()) {
                throw new GraphConfigurationException("Conditional edge from '" + from + "' has an empty path map");
            }
            putEdge(from, new Edge(null, router, Map.copyOf(pathMap)));
            return this;
        }

        private void putEdge(String from, Edge edge) {
            if (edges.put(from, edge) != null) {
                throw new GraphConfigurationException("Node '" + from + "' already has an outgoing edge");
            }
        }

        public Builder start(String nodeName) {
            this.startNode = nodeName;
            return this;
        }

        public Builder interruptBefore(String... nodeNames) {
            interruptBefore.addAll(Arrays.asList(nodeNames));
            return this;
        }

        public Builder resolutionPolicy(ResolutionPolicy policy) {
            this.resolutionPolicy = policy;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            if (maxSteps < 1) {
                throw new GraphConfigurationException("maxSteps must be positive");
            }
            this.maxSteps = maxSteps;
            return this;
        }

        public GraphDefinition build() {
            if (!duplicates.isEmpty()) {
                throw new GraphConfigurationException("Duplicate node names: " + duplicates);
            }
            if (startNode == null || !nodes.containsKey(startNode)) {
                throw new GraphConfigurationException("Start node '" + startNode + "' is not a node of graph " + name);
            }
            for (String node : nodes.keySet()) {
                if (!edges.containsKey(node)) {
                    throw new GraphConfigurationException("Node '" + node + "' has no outgoing edge");
                }
            }
            for (Map.Entry<String, Edge> e : edges.entrySet()) {
                if (!nodes.containsKey(e.getKey())) {
                    throw new GraphConfigurationException("Edge from unknown node '" + e.getKey() + "'");
                }
                for (String target : e.getValue().targets()) {
                    if (!END.equals(target) && !nodes.containsKey(target)) {
                        throw new GraphConfigurationException("Edge from '" + e.getKey()
                                + "' targets unknown node '" + target + "'");
                    }
                }
            }
            for (String node : interruptBefore) {
                if (!nodes.containsKey(node)) {
                    throw new GraphConfigurationException("Interrupt-before node '" + node + "' does not exist");
                }
            }
            Set<String> unreachable = new HashSet<>(nodes.keySet());
            unreachable.removeAll(reachableFrom(startNode));
            if (!unreachable.isEmpty()) {
                throw new GraphConfigurationException("Unreachable nodes: " + unreachable);
            }
            return new GraphDefinition(this);
        }

        private Set<String> reachableFrom(String start) {
            Set<String> seen = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.push(start);
            while (!pending.isEmpty()) {
                String current = pending.pop();
                if (END.equals(current) || !seen.add(current)) {
                    continue;
                }
                Optional.ofNullable(edges.get(current)).ifPresent(edge -> edge.targets().forEach(pending::push));
            }
            return seen;
        }
    }
}
