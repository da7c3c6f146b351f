package com.finmod.drg;

import com.finmod.drg.engine.CellNode;
import com.finmod.drg.engine.DependencyGraph;
import com.finmod.drg.engine.LevelAssigner;
import com.finmod.drg.io.CellListing;
import com.finmod.drg.io.CellListingReader;
import com.finmod.drg.io.GraphSnapshot;
import com.finmod.drg.io.JsonSnapshotSerializer;
import com.finmod.drg.query.GraphQueryService;
import com.finmod.drg.query.GraphStats;
import com.finmod.drg.util.GraphExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A high-level wrapper that runs the whole pipeline for one workbook.
 * <p>
 * This class handles:
 * <ul>
 * <li>Reading a JSON cell listing with {@link CellListingReader}</li>
 * <li>Building and verifying the graph with {@link GraphBuilder}</li>
 * <li>Assigning levels with {@link LevelAssigner}</li>
 * <li>Exposing the finished graph through {@link GraphQueryService}</li>
 * </ul>
 * One instance covers one analysis run; build a new one when the workbook
 * changes.
 */
public class CellGraph {
    private static final Logger log = LogManager.getLogger(CellGraph.class);

    private final DependencyGraph graph;
    private final GraphQueryService query;

    /**
     * Loads a listing from a JSON file.
     *
     * @param jsonPath Path to the listing.
     */
    public CellGraph(Path jsonPath) {
        this(load(jsonPath));
    }

    public CellGraph(CellListing listing) {
        this(GraphBuilder.create(listing.getName() != null ? listing.getName() : "workbook").cells(listing));
    }

    /**
     * Builds from a configured builder.
     *
     * @throws com.finmod.drg.engine.CircularReferenceException if the
     *                                                          workbook has
     *                                                          circular
     *                                                          references.
     */
    public CellGraph(GraphBuilder builder) {
        this.graph = builder.build();
        if (!new LevelAssigner().assignLevels(graph))
            log.error("Graph '{}' is not levelled; calculation order is unreliable", graph.name());
        this.query = new GraphQueryService(graph);
        log.info("Graph '{}' ready: {}", graph.name(), query.stats().toMap());
    }

    private static CellListing load(Path jsonPath) {
        try {
            return new CellListingReader().read(jsonPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load cell listing from " + jsonPath, e);
        }
    }

    public DependencyGraph graph() {
        return graph;
    }

    public GraphQueryService query() {
        return query;
    }

    public CellNode node(String fullAddress) {
        return graph.node(fullAddress);
    }

    public List<List<String>> calculationOrder() {
        return query.calculationOrder();
    }

    public GraphStats stats() {
        return query.stats();
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }

    public GraphSnapshot snapshot() {
        return GraphSnapshot.capture(query);
    }

    /** Writes the snapshot as JSON for an external renderer. */
    public void writeSnapshot(Path path) throws IOException {
        new JsonSnapshotSerializer().write(snapshot(), path);
    }
}
