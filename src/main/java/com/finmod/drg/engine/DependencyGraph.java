package com.finmod.drg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * The verified cell dependency graph.
 *
 * <p>
 * Holds every cell of one workbook keyed by full address, plus the CSR
 * {@link TopologicalOrder} derived from the same edges. Instances exist only
 * after acyclicity has been verified: {@link Builder#build()} either returns a
 * fully wired graph or throws {@link CircularReferenceException} with nothing
 * committed.
 *
 * <p>
 * Apart from node levels (written by {@link LevelAssigner}) the graph is
 * immutable. There is no incremental update path; rebuild to reflect edits.
 */
@Log4j2
public final class DependencyGraph {
    /** Cycles reported by {@link CircularReferenceException} unless configured. */
    public static final int DEFAULT_CYCLE_SAMPLES = CycleFinder.DEFAULT_SAMPLE_LIMIT;

    private final String name;
    private final Map<String, CellNode> nodes;
    private final TopologicalOrder topology;
    private final Map<String, String> namedRanges;
    private volatile boolean leveled;

    private DependencyGraph(String name, Map<String, CellNode> nodes, TopologicalOrder topology,
            Map<String, String> namedRanges) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.topology = topology;
        this.namedRanges = Collections.unmodifiableMap(namedRanges);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public int size() {
        return nodes.size();
    }

    /** All nodes in listing order. Read-only. */
    public Map<String, CellNode> nodes() {
        return nodes;
    }

    /** Node for a full address, or null if the cell is not in the graph. */
    public CellNode node(String fullAddress) {
        return nodes.get(fullAddress);
    }

    public boolean contains(String fullAddress) {
        return nodes.containsKey(fullAddress);
    }

    public TopologicalOrder topology() {
        return topology;
    }

    public int edgeCount() {
        return topology.edgeCount();
    }

    /** Named ranges as supplied with the listing; metadata only, never edges. */
    public Map<String, String> namedRanges() {
        return namedRanges;
    }

    /** True once {@link LevelAssigner} has completed successfully. */
    public boolean isLeveled() {
        return leveled;
    }

    void markLeveled(boolean leveled) {
        this.leveled = leveled;
    }

    public int maxLevel() {
        int max = 0;
        for (CellNode node : nodes.values())
            max = Math.max(max, node.level());
        return max;
    }

    @Override
    public String toString() {
        return "DependencyGraph[" + name + ", " + nodes.size() + " cells, " + edgeCount() + " edges]";
    }

    /**
     * Collects nodes and edges, then verifies and commits them in one step.
     *
     * <p>
     * Edges are written into the nodes only after the topology has been
     * verified acyclic. Not thread-safe; meant to be fed from one thread after
     * any parallel parsing has finished.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, CellNode> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, String> namedRanges = new LinkedHashMap<>();
        private int maxCycleSamples = DEFAULT_CYCLE_SAMPLES;
        private boolean built;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder addNode(CellNode node) {
            checkNotBuilt();
            if (nodes.putIfAbsent(node.fullAddress(), node) != null)
                throw new IllegalArgumentException("Duplicate cell: " + node.fullAddress());
            return this;
        }

        public boolean contains(String fullAddress) {
            return nodes.containsKey(fullAddress);
        }

        /**
         * Records that {@code referencing} reads {@code referenced}.
         *
         * @throws IllegalArgumentException if either cell is unknown or the
         *                                  referencing cell has no formula.
         */
        public Builder addEdge(String referenced, String referencing) {
            checkNotBuilt();
            if (!nodes.containsKey(referenced))
                throw new IllegalArgumentException("Unknown cell: " + referenced);
            CellNode target = nodes.get(referencing);
            if (target == null)
                throw new IllegalArgumentException("Unknown cell: " + referencing);
            if (!target.hasFormula())
                throw new IllegalArgumentException("Literal cell " + referencing + " cannot reference " + referenced);
            edges.add(new Edge(referenced, referencing));
            return this;
        }

        public Builder namedRange(String rangeName, String target) {
            checkNotBuilt();
            namedRanges.put(rangeName, target);
            return this;
        }

        public Builder maxCycleSamples(int limit) {
            checkNotBuilt();
            if (limit < 1)
                throw new IllegalArgumentException("Cycle sample limit must be positive: " + limit);
            this.maxCycleSamples = limit;
            return this;
        }

        /**
         * Verifies acyclicity and commits all edges.
         *
         * @throws CircularReferenceException if the edges form a cycle; no graph
         *                                    is produced.
         */
        public DependencyGraph build() {
            checkNotBuilt();
            built = true;

            var topo = TopologicalOrder.builder().maxCycleSamples(maxCycleSamples);
            for (String address : nodes.keySet())
                topo.addNode(address);
            for (Edge edge : edges)
                topo.addEdge(edge.from(), edge.to());
            TopologicalOrder topology = topo.build();

            // Verified: commit both ends of every edge
            for (Edge edge : edges) {
                nodes.get(edge.from()).addDependent(edge.to());
                nodes.get(edge.to()).addDependency(edge.from());
            }
            log.debug("Committed {} edges across {} cells for '{}'", topology.edgeCount(), nodes.size(), name);
            return new DependencyGraph(name, nodes, topology, namedRanges);
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("Graph already built");
        }
    }

    /** Directed edge: {@code to} reads {@code from}. */
    public record Edge(String from, String to) {
    }
}
