package com.finmod.drg.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate diagnostics for one graph.
 *
 * @param totalCells      every node, literal or formula.
 * @param formulaCells    nodes with a formula.
 * @param inputCells      literal leaves.
 * @param outputCells     formula cells nothing else reads.
 * @param maxLevel        highest topological level.
 * @param cellsPerLevel   formula cells per level, 0..maxLevel, empty levels
 *                        included.
 * @param avgDependencies mean fan-in across all nodes.
 * @param maxDependencies largest fan-in of any node.
 * @param acyclic         whether the edge relation is a DAG.
 */
public record GraphStats(int totalCells, int formulaCells, int inputCells, int outputCells, int maxLevel,
        Map<Integer, Integer> cellsPerLevel, double avgDependencies, int maxDependencies, boolean acyclic) {

    public GraphStats {
        cellsPerLevel = Collections.unmodifiableMap(new LinkedHashMap<>(cellsPerLevel));
    }

    /** Plain key/value form for logging and downstream tools. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total_cells", totalCells);
        out.put("formula_cells", formulaCells);
        out.put("input_cells", inputCells);
        out.put("output_cells", outputCells);
        out.put("max_level", maxLevel);
        out.put("cells_per_level", cellsPerLevel);
        out.put("avg_dependencies", avgDependencies);
        out.put("max_dependencies", maxDependencies);
        out.put("is_dag", acyclic);
        return out;
    }
}
