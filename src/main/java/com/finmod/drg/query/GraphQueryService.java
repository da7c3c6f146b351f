package com.finmod.drg.query;

import com.finmod.drg.engine.CellNode;
import com.finmod.drg.engine.DependencyGraph;
import com.finmod.drg.engine.TopologicalOrder;
import com.finmod.drg.formula.FormulaClassifier;
import com.finmod.drg.formula.FormulaType;
import com.finmod.drg.formula.ImplementationStrategy;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Read-only queries over a built and levelled {@link DependencyGraph}.
 *
 * <p>
 * Direct lookups go through the nodes' edge sets. Transitive closures walk the
 * graph's CSR {@link TopologicalOrder} with a visited bitmap. Unknown addresses
 * yield empty results rather than errors.
 */
@Log4j2
public final class GraphQueryService {
    private final DependencyGraph graph;
    private final TopologicalOrder topology;
    private final FormulaClassifier classifier;

    public GraphQueryService(DependencyGraph graph) {
        this(graph, new FormulaClassifier());
    }

    public GraphQueryService(DependencyGraph graph, FormulaClassifier classifier) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.topology = graph.topology();
        this.classifier = classifier;
        if (!graph.isLeveled())
            log.warn("Querying graph '{}' before levels were assigned", graph.name());
    }

    public DependencyGraph graph() {
        return graph;
    }

    /** Cells the given cell reads directly. */
    public Set<String> dependencies(String fullAddress) {
        CellNode node = graph.node(fullAddress);
        return node == null ? Set.of() : node.dependencies();
    }

    /** Cells that read the given cell directly. */
    public Set<String> dependents(String fullAddress) {
        CellNode node = graph.node(fullAddress);
        return node == null ? Set.of() : node.dependents();
    }

    /** Every ancestor of the cell. */
    public Set<String> transitiveDependencies(String fullAddress) {
        return reach(fullAddress, false);
    }

    /** Every descendant of the cell. */
    public Set<String> transitiveDependents(String fullAddress) {
        return reach(fullAddress, true);
    }

    private Set<String> reach(String fullAddress, boolean downstream) {
        int start = topology.indexOf(fullAddress);
        if (start < 0)
            return Set.of();
        boolean[] visited = new boolean[topology.nodeCount()];
        int[] queue = new int[topology.nodeCount()];
        int head = 0, tail = 0;
        queue[tail++] = start;
        visited[start] = true;
        Set<String> out = new LinkedHashSet<>();
        while (head < tail) {
            int curr = queue[head++];
            int count = downstream ? topology.childCount(curr) : topology.parentCount(curr);
            for (int i = 0; i < count; i++) {
                int next = downstream ? topology.child(curr, i) : topology.parent(curr, i);
                if (!visited[next]) {
                    visited[next] = true;
                    queue[tail++] = next;
                    out.add(topology.address(next));
                }
            }
        }
        return Collections.unmodifiableSet(out);
    }

    /** Literal cells with no dependencies, in listing order. */
    public List<String> inputCells() {
        List<String> out = new ArrayList<>();
        for (CellNode node : graph.nodes().values())
            if (!node.hasFormula() && node.dependencies().isEmpty())
                out.add(node.fullAddress());
        return out;
    }

    /** Formula cells nothing else reads, in listing order. */
    public List<String> outputCells() {
        List<String> out = new ArrayList<>();
        for (CellNode node : graph.nodes().values())
            if (node.hasFormula() && node.dependents().isEmpty())
                out.add(node.fullAddress());
        return out;
    }

    /**
     * Formula cells bucketed by level. Bucket {@code i} holds the formula cells
     * at level {@code i}; there is one bucket for every level from 0 to the
     * maximum, empty ones included. Cells within a bucket are independent.
     */
    public List<List<String>> calculationOrder() {
        int maxLevel = graph.maxLevel();
        List<List<String>> buckets = new ArrayList<>(maxLevel + 1);
        for (int i = 0; i <= maxLevel; i++)
            buckets.add(new ArrayList<>());
        for (CellNode node : graph.nodes().values())
            if (node.hasFormula())
                buckets.get(node.level()).add(node.fullAddress());
        return buckets;
    }

    /** Formula-cell count per category. */
    public Map<FormulaType, Integer> typeHistogram() {
        Map<FormulaType, Integer> out = new EnumMap<>(FormulaType.class);
        for (CellNode node : graph.nodes().values())
            if (node.parsed() != null)
                out.merge(node.parsed().type(), 1, Integer::sum);
        return out;
    }

    /** Formula-cell count per recommended implementation strategy. */
    public Map<ImplementationStrategy, Integer> strategyHistogram() {
        Map<ImplementationStrategy, Integer> out = new EnumMap<>(ImplementationStrategy.class);
        for (CellNode node : graph.nodes().values())
            if (node.parsed() != null)
                out.merge(classifier.recommendStrategy(node.parsed()), 1, Integer::sum);
        return out;
    }

    public GraphStats stats() {
        int total = graph.size(), formulas = 0, inputs = 0, outputs = 0, maxLevel = 0;
        int fanInSum = 0, fanInMax = 0;
        for (CellNode node : graph.nodes().values()) {
            int fanIn = node.dependencies().size();
            fanInSum += fanIn;
            fanInMax = Math.max(fanInMax, fanIn);
            maxLevel = Math.max(maxLevel, node.level());
            if (node.hasFormula()) {
                formulas++;
                if (node.dependents().isEmpty())
                    outputs++;
            } else if (fanIn == 0) {
                inputs++;
            }
        }
        Map<Integer, Integer> perLevel = new LinkedHashMap<>();
        List<List<String>> order = calculationOrder();
        for (int i = 0; i < order.size(); i++)
            perLevel.put(i, order.get(i).size());
        double avg = total == 0 ? 0.0 : (double) fanInSum / total;
        return new GraphStats(total, formulas, inputs, outputs, maxLevel, perLevel, avg, fanInMax, isAcyclic());
    }

    // Independent Kahn pass over the node sets; does not trust the level values.
    private boolean isAcyclic() {
        Map<String, Integer> pending = new HashMap<>(graph.size() * 2);
        Deque<String> ready = new ArrayDeque<>();
        for (CellNode node : graph.nodes().values()) {
            pending.put(node.fullAddress(), node.dependencies().size());
            if (node.dependencies().isEmpty())
                ready.add(node.fullAddress());
        }
        int ordered = 0;
        while (!ready.isEmpty()) {
            CellNode node = graph.node(ready.poll());
            ordered++;
            for (String dependent : node.dependents())
                if (pending.merge(dependent, -1, Integer::sum) == 0)
                    ready.add(dependent);
        }
        return ordered == graph.size();
    }
}
