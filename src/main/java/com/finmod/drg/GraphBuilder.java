package com.finmod.drg;

import com.finmod.drg.api.CellRecord;
import com.finmod.drg.engine.*;
import com.finmod.drg.formula.*;
import com.finmod.drg.io.CellListing;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Graph Builder: turns a workbook's cell listing into a verified
 * {@link DependencyGraph}.
 *
 * <p>
 * Construction runs in three phases:
 * <ol>
 * <li><b>Nodes:</b> every listed cell, literal or formula, gets an address;
 * duplicates are rejected.</li>
 * <li><b>References:</b> each formula is parsed and its references resolved
 * against its own sheet. This step is a pure function per cell and may run on
 * a parallel stream. The results are then committed as edges on the calling
 * thread. References to cells that are not in the listing are dropped.</li>
 * <li><b>Verification:</b> the edge set is checked for cycles; on success the
 * edges are written into the nodes in one step.</li>
 * </ol>
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * DependencyGraph graph = GraphBuilder.create("model")
 *         .literal("Sheet1", "A1", 10)
 *         .formula("Sheet1", "B1", "=A1*2")
 *         .build();
 * }</pre>
 *
 * <p>
 * The builder is stateful and not thread-safe. Once {@link #build()} is called,
 * the builder is invalidated and cannot be used to add more cells.
 */
public final class GraphBuilder {
    private static final Logger log = LogManager.getLogger(GraphBuilder.class);

    private final String graphName;
    private final FormulaParser parser;

    private final List<CellRecord> cells = new ArrayList<>();
    private final Map<String, String> namedRanges = new LinkedHashMap<>();

    private boolean parallel;
    private int maxCycleSamples = DependencyGraph.DEFAULT_CYCLE_SAMPLES;

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName, FormulaParser parser) {
        this.graphName = Objects.requireNonNull(graphName, "graphName");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Creates a new GraphBuilder instance.
     *
     * @param graphName A human-readable name for the graph, used in logs and
     *                  snapshots.
     * @return A new builder instance.
     */
    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName, new FormulaParser());
    }

    public static GraphBuilder create(String graphName, FormulaParser parser) {
        return new GraphBuilder(graphName, parser);
    }

    // ── Cells ────────────────────────────────────────────────────

    public GraphBuilder literal(String sheet, String address, Object value) {
        return cell(CellRecord.literal(sheet, address, value));
    }

    public GraphBuilder formula(String sheet, String address, String formula) {
        return cell(CellRecord.formula(sheet, address, formula));
    }

    public GraphBuilder cell(CellRecord record) {
        checkNotBuilt();
        cells.add(record);
        return this;
    }

    /** Adds every cell and named range of a listing. */
    public GraphBuilder cells(CellListing listing) {
        checkNotBuilt();
        cells.addAll(listing.records());
        if (listing.getNamedRanges() != null)
            namedRanges.putAll(listing.getNamedRanges());
        return this;
    }

    /** Records a named range. Carried as metadata; never expanded into edges. */
    public GraphBuilder namedRange(String name, String target) {
        checkNotBuilt();
        namedRanges.put(name, target);
        return this;
    }

    // ── Options ──────────────────────────────────────────────────

    /** Parse formulas on a parallel stream. Edge commit stays single-threaded. */
    public GraphBuilder parallel(boolean parallel) {
        checkNotBuilt();
        this.parallel = parallel;
        return this;
    }

    /** Upper bound on cycles reported by {@link CircularReferenceException}. */
    public GraphBuilder maxCycleSamples(int limit) {
        checkNotBuilt();
        if (limit < 1)
            throw new IllegalArgumentException("Cycle sample limit must be positive: " + limit);
        this.maxCycleSamples = limit;
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Compiles the listing into a verified graph. Levels are not assigned; see
     * {@link LevelAssigner}.
     *
     * @throws CircularReferenceException if the formulas reference each other in
     *                                    a cycle.
     * @throws IllegalArgumentException   on malformed or duplicate addresses.
     */
    public DependencyGraph build() {
        checkNotBuilt();
        built = true;
        log.info("Building dependency graph '{}' from {} cells", graphName, cells.size());

        // 1. Resolve addresses, reject duplicates
        List<ResolvedCell> resolved = new ArrayList<>(cells.size());
        Set<String> seen = new HashSet<>(cells.size() * 2);
        for (CellRecord record : cells) {
            CellAddress address = CellAddress.parse(record.address(), record.sheet());
            if (!seen.add(address.fullAddress()))
                throw new IllegalArgumentException("Duplicate cell: " + address.fullAddress());
            resolved.add(new ResolvedCell(record, address));
        }

        // 2a. Parse formulas; pure per cell
        Stream<ResolvedCell> stream = parallel ? resolved.parallelStream() : resolved.stream();
        List<ParsedCell> parsed = stream.map(this::parse).collect(Collectors.toList());

        // 2b. Commit nodes and edges on this thread
        var graph = DependencyGraph.builder(graphName).maxCycleSamples(maxCycleSamples);
        for (ParsedCell cell : parsed)
            graph.addNode(cell.node());
        namedRanges.forEach(graph::namedRange);

        int dropped = 0;
        for (ParsedCell cell : parsed) {
            for (String ref : cell.references()) {
                if (graph.contains(ref)) {
                    graph.addEdge(ref, cell.node().fullAddress());
                } else {
                    dropped++;
                    log.debug("Dropping unresolved reference {} in {}", ref, cell.node().fullAddress());
                }
            }
        }
        if (dropped > 0)
            log.debug("Dropped {} unresolved references in '{}'", dropped, graphName);

        // 3. Verify and commit
        DependencyGraph result = graph.build();
        log.info("Built dependency graph '{}' with {} cells and {} edges", graphName, result.size(),
                result.edgeCount());
        return result;
    }

    private ParsedCell parse(ResolvedCell cell) {
        CellRecord record = cell.record();
        if (!record.hasFormula())
            return new ParsedCell(CellNode.literal(cell.address(), record.value()), Set.of());
        ReferenceScan scan = parser.extractor().scan(record.formula());
        ParsedFormula formula = parser.parse(scan);
        CellNode node = new CellNode(cell.address(), record.formula(), record.value(), formula);
        return new ParsedCell(node, scan.resolve(cell.address().sheet()));
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }

    private record ResolvedCell(CellRecord record, CellAddress address) {
    }

    private record ParsedCell(CellNode node, Set<String> references) {
    }
}
