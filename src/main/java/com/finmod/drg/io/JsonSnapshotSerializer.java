package com.finmod.drg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Writes {@link GraphSnapshot}s as pretty-printed JSON.
 */
@Log4j2
public final class JsonSnapshotSerializer {
    private final ObjectMapper mapper;

    public JsonSnapshotSerializer() {
        this(new ObjectMapper());
    }

    public JsonSnapshotSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(GraphSnapshot snapshot) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot of " + snapshot.getName(), e);
        }
    }

    public void write(GraphSnapshot snapshot, Path path) throws IOException {
        Files.writeString(path, toJson(snapshot));
        log.info("Graph snapshot of '{}' saved to {}", snapshot.getName(), path);
    }

    public GraphSnapshot read(String json) {
        try {
            return mapper.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
