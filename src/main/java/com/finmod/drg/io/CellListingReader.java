package com.finmod.drg.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a JSON {@link CellListing}.
 */
public final class CellListingReader {
    private final ObjectMapper mapper;

    public CellListingReader() {
        this(new ObjectMapper().configure(DeserializationFeature.USE_LONG_FOR_INTS, true));
    }

    public CellListingReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Parses a listing file. */
    public CellListing read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public CellListing read(InputStream in) throws IOException {
        return mapper.readValue(in, CellListing.class);
    }

    /**
     * Parses a listing held in memory.
     *
     * @throws IllegalArgumentException if the text is not a valid listing.
     */
    public CellListing parse(String json) {
        try {
            return mapper.readValue(json, CellListing.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid cell listing: " + e.getOriginalMessage(), e);
        }
    }
}
