package com.finmod.drg.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.finmod.drg.engine.CellNode;
import com.finmod.drg.engine.DependencyGraph;
import com.finmod.drg.formula.FormulaClassifier;
import com.finmod.drg.formula.ParsedFormula;
import com.finmod.drg.query.GraphQueryService;

import lombok.Data;

/**
 * Serializable picture of a levelled graph: stats plus per-cell layout
 * metadata (address, level, edges, classification) for an external renderer
 * or code generator.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphSnapshot {
    private String name;
    private boolean leveled;
    private Map<String, Object> stats;
    private List<List<String>> calculationOrder;
    private List<NodeInfo> nodes = new ArrayList<>();

    /** One cell of the snapshot. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeInfo {
        private String address, sheet, formula;
        private Object value;
        private int level;
        private String type, strategy;
        private Integer complexity;
        private List<String> dependencies, dependents;
    }

    /** Captures the current state of a graph. */
    public static GraphSnapshot capture(GraphQueryService query) {
        DependencyGraph graph = query.graph();
        FormulaClassifier classifier = new FormulaClassifier();

        GraphSnapshot snapshot = new GraphSnapshot();
        snapshot.setName(graph.name());
        snapshot.setLeveled(graph.isLeveled());
        snapshot.setStats(query.stats().toMap());
        snapshot.setCalculationOrder(query.calculationOrder());
        for (CellNode node : graph.nodes().values()) {
            NodeInfo info = new NodeInfo();
            info.setAddress(node.fullAddress());
            info.setSheet(node.sheet());
            info.setFormula(node.formula());
            info.setValue(node.value());
            info.setLevel(node.level());
            info.setDependencies(new ArrayList<>(node.dependencies()));
            info.setDependents(new ArrayList<>(node.dependents()));
            ParsedFormula parsed = node.parsed();
            if (parsed != null) {
                info.setType(parsed.type().name());
                info.setComplexity(parsed.complexityScore());
                info.setStrategy(classifier.recommendStrategy(parsed).label());
            }
            snapshot.getNodes().add(info);
        }
        return snapshot;
    }
}
