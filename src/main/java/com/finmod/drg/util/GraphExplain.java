package com.finmod.drg.util;

import com.finmod.drg.engine.CellNode;
import com.finmod.drg.engine.DependencyGraph;
import com.finmod.drg.engine.TopologicalOrder;
import com.finmod.drg.formula.FormulaClassifier;
import com.finmod.drg.formula.ParsedFormula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * <p>
 * This class generates human-readable string representations of the graph
 * structure and of individual cells.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics. Allocates freely; keep it off bulk paths.
 */
public final class GraphExplain {
    private final DependencyGraph graph;
    private final TopologicalOrder topology;
    private final FormulaClassifier classifier = new FormulaClassifier();

    public GraphExplain(DependencyGraph graph) {
        this.graph = graph;
        this.topology = graph.topology();
    }

    /**
     * Dumps detailed state of a single cell.
     *
     * @throws IllegalArgumentException if the cell is not in the graph.
     */
    public String explainNode(String fullAddress) {
        int idx = topology.topoIndex(fullAddress);
        CellNode node = graph.node(fullAddress);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Cell: ").append(fullAddress).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Level: ").append(node.level()).append('\n');
        if (node.hasFormula()) {
            sb.append("  Formula: ").append(node.formula()).append('\n');
            ParsedFormula parsed = node.parsed();
            if (parsed != null)
                sb.append("  Type: ").append(parsed.type())
                        .append(", complexity ").append(parsed.complexityScore())
                        .append(", strategy ").append(classifier.recommendStrategy(parsed).label()).append('\n');
        } else {
            sb.append("  Value: ").append(node.value()).append('\n');
        }
        appendList(sb, "Depends on", node.dependencies());
        appendList(sb, "Read by", node.dependents());
        return sb.toString();
    }

    /**
     * Dumps the entire topology in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(topology.nodeCount()).append(" cells):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            CellNode node = graph.node(topology.address(i));
            sb.append("  [").append(i).append("] ").append(node.fullAddress());
            if (!node.hasFormula())
                sb.append(" (INPUT)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.address(topology.child(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * One line per level listing every cell at that level, inputs included.
     */
    public String dumpLevels() {
        List<List<String>> levels = new ArrayList<>();
        for (int i = 0; i <= graph.maxLevel(); i++)
            levels.add(new ArrayList<>());
        for (CellNode node : graph.nodes().values())
            levels.get(node.level()).add(node.fullAddress());
        StringBuilder sb = new StringBuilder(512);
        for (int i = 0; i < levels.size(); i++)
            sb.append("  L").append(i).append(": ").append(String.join(", ", levels.get(i))).append('\n');
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, Collection<String> items) {
        sb.append("  ").append(label).append(" (").append(items.size()).append("): ")
                .append(String.join(", ", items)).append('\n');
    }
}
