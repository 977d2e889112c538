package com.whereq.vigil.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.whereq.vigil.exception.FetchInvalidException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates staged snapshots and atomically promotes them over the previous one.
 * A snapshot that fails validation never replaces the file it was meant to update.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class SnapshotStore {

    private final ObjectReader reader;
    private final long minBytes;

    public SnapshotStore(ObjectMapper objectMapper, long minBytes) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.minBytes = minBytes;
    }

    /**
     * Staging location next to the snapshot, so the final move stays on one filesystem.
     */
    public Path stagingPath(Path snapshot) {
        return snapshot.resolveSibling(snapshot.getFileName() + ".tmp");
    }

    /**
     * Check that a staged file holds exactly one JSON document and is larger than the minimum size.
     *
     * @throws FetchInvalidException when it does not
     */
    public JsonNode validate(Path staged) {
        long size;
        try {
            size = Files.size(staged);
        } catch (IOException e) {
            throw new FetchInvalidException("Fetched data missing at " + staged, e);
        }
        if (size <= minBytes) {
            throw new FetchInvalidException("Fetched data too small: " + size + " bytes (minimum " + (minBytes + 1) + ")");
        }

        JsonNode document;
        try (InputStream in = Files.newInputStream(staged)) {
            document = reader.readTree(in);
        } catch (JsonProcessingException e) {
            throw new FetchInvalidException("Invalid JSON in fetched data: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FetchInvalidException("Cannot read fetched data at " + staged, e);
        }
        if (document == null || document.isMissingNode()) {
            throw new FetchInvalidException("Fetched data holds no JSON document");
        }
        return document;
    }

    /**
     * Read a committed snapshot.
     */
    public JsonNode read(Path snapshot) {
        if (!Files.isRegularFile(snapshot)) {
            throw new FetchInvalidException("No snapshot at " + snapshot);
        }
        return validate(snapshot);
    }

    /**
     * Record elements of a snapshot: the array itself, the array under {@code recordsPath},
     * or a single object.
     */
    public static List<JsonNode> records(JsonNode document, String recordsPath) {
        JsonNode node = recordsPath == null || recordsPath.isBlank() ? document : document.path(recordsPath);
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            node.forEach(elements::add);
            return elements;
        }
        if (node.isObject()) {
            return List.of(node);
        }
        return List.of();
    }

    /**
     * Validate the staged file and move it over the snapshot.
     *
     * @return the committed snapshot
     */
    public Path commit(Path staged, Path snapshot) {
        validate(staged);
        try {
            Files.move(staged, snapshot, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new FetchInvalidException("Cannot replace snapshot " + snapshot, e);
        }
        log.info("Snapshot updated: {}", snapshot);
        return snapshot;
    }
}
