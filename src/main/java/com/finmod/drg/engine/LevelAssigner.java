package com.finmod.drg.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns each cell its topological level.
 *
 * <p>
 * Layered Kahn traversal over the nodes' own dependency sets:
 * <ol>
 * <li>Layer 0 holds every cell with no dependencies.</li>
 * <li>A cell joins layer {@code k + 1} when its last unprocessed dependency
 * is processed in layer {@code k}, which makes its level
 * {@code 1 + max(level of its dependencies)}.</li>
 * </ol>
 * Each layer is a barrier: cells inside one layer never depend on each other
 * and may be evaluated concurrently.
 *
 * <p>
 * Levels are written only once the whole graph has been ordered. If ordering
 * fails (the node sets contain a cycle even though the graph passed
 * verification) every level is reset to 0, the graph is flagged as not
 * leveled and the problem is logged as an internal error. Nothing is thrown.
 */
public final class LevelAssigner {
    private static final Logger log = LogManager.getLogger(LevelAssigner.class);

    /**
     * @return true if every node was levelled; false on an internal ordering
     *         failure, in which case all levels are 0.
     */
    public boolean assignLevels(DependencyGraph graph) {
        Map<String, CellNode> nodes = graph.nodes();
        Map<String, Integer> pending = new HashMap<>(nodes.size() * 2);
        List<CellNode> layer = new ArrayList<>();
        for (CellNode node : nodes.values()) {
            int deps = node.dependencies().size();
            pending.put(node.fullAddress(), deps);
            if (deps == 0)
                layer.add(node);
        }

        Map<String, Integer> levels = new HashMap<>(nodes.size() * 2);
        int level = 0;
        while (!layer.isEmpty()) {
            List<CellNode> next = new ArrayList<>();
            for (CellNode node : layer) {
                levels.put(node.fullAddress(), level);
                for (String dependent : node.dependents()) {
                    Integer remaining = pending.get(dependent);
                    if (remaining == null)
                        return fail(graph, "Dangling dependent " + dependent + " of " + node.fullAddress());
                    pending.put(dependent, remaining - 1);
                    if (remaining == 1)
                        next.add(nodes.get(dependent));
                }
            }
            log.debug("Level {}: {} cells", level, layer.size());
            layer = next;
            level++;
        }

        if (levels.size() != nodes.size())
            return fail(graph, "Ordered " + levels.size() + " of " + nodes.size()
                    + " cells in a graph verified acyclic");

        for (CellNode node : nodes.values())
            node.setLevel(levels.get(node.fullAddress()));
        graph.markLeveled(true);
        log.debug("Assigned {} levels to {} cells in '{}'", level, nodes.size(), graph.name());
        return true;
    }

    private static boolean fail(DependencyGraph graph, String message) {
        for (CellNode node : graph.nodes().values())
            node.setLevel(0);
        graph.markLeveled(false);
        log.error("Level assignment failed for '{}'; all levels left at 0", graph.name(),
                new LevelingInvariantException(message));
        return false;
    }
}
