package com.finmod.drg.io;

import com.finmod.drg.GraphBuilder;
import com.finmod.drg.engine.DependencyGraph;
import com.finmod.drg.engine.LevelAssigner;
import com.finmod.drg.query.GraphQueryService;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class JsonSnapshotSerializerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final JsonSnapshotSerializer serializer = new JsonSnapshotSerializer();

    private static GraphSnapshot sample() {
        DependencyGraph graph = GraphBuilder.create("chain")
                .literal("Sheet1", "A1", 5)
                .formula("Sheet1", "B1", "=A1*2")
                .formula("Sheet1", "C1", "=SUM(B1:B1)")
                .build();
        new LevelAssigner().assignLevels(graph);
        return GraphSnapshot.capture(new GraphQueryService(graph));
    }

    @Test
    public void testCapture() {
        GraphSnapshot snapshot = sample();
        assertEquals("chain", snapshot.getName());
        assertTrue(snapshot.isLeveled());
        assertEquals(3, snapshot.getNodes().size());
        assertEquals(List.of(List.of(), List.of("Sheet1!B1"), List.of("Sheet1!C1")),
                snapshot.getCalculationOrder());

        GraphSnapshot.NodeInfo a1 = snapshot.getNodes().get(0);
        assertEquals("Sheet1!A1", a1.getAddress());
        assertNull(a1.getType());
        assertNull(a1.getComplexity());
        assertEquals(List.of("Sheet1!B1"), a1.getDependents());

        GraphSnapshot.NodeInfo c1 = snapshot.getNodes().get(2);
        assertEquals(2, c1.getLevel());
        assertEquals("STATISTICAL", c1.getType());
        assertEquals("pandas_method", c1.getStrategy());
    }

    @Test
    public void testJsonRoundTrip() {
        String json = serializer.toJson(sample());
        assertTrue(json.contains("\"is_dag\" : true"));

        GraphSnapshot back = serializer.read(json);
        assertEquals("chain", back.getName());
        assertEquals(3, back.getNodes().size());
        assertEquals("Sheet1!B1", back.getNodes().get(1).getAddress());
        assertEquals(List.of("Sheet1!A1"), back.getNodes().get(1).getDependencies());
        assertEquals(1, back.getNodes().get(1).getLevel());
    }

    @Test
    public void testWrite() throws Exception {
        Path out = tmp.getRoot().toPath().resolve("snapshot.json");
        serializer.write(sample(), out);
        assertTrue(Files.exists(out));
        assertEquals("chain", serializer.read(Files.readString(out)).getName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReadInvalid() {
        serializer.read("not json");
    }
}
