package com.whereq.vigil.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.vigil.model.ScanTarget;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scan targets taken from another job's snapshot: one per identity, in snapshot order,
 * skipping entries without an address or identity.
 */
@Slf4j
public class SnapshotTargetSource {

    private final Path snapshot;
    private final String recordsPath;
    private final String addressField;
    private final String identityField;
    private final int limit;
    private final SnapshotStore store;

    public SnapshotTargetSource(Path snapshot, String recordsPath, String addressField, String identityField,
                                int limit, SnapshotStore store) {
        this.snapshot = snapshot;
        this.recordsPath = recordsPath;
        this.addressField = addressField;
        this.identityField = identityField;
        this.limit = limit;
        this.store = store;
    }

    public List<ScanTarget> load() {
        Map<String, ScanTarget> byIdentity = new LinkedHashMap<>();
        for (JsonNode element : SnapshotStore.records(store.read(snapshot), recordsPath)) {
            String address = text(element, addressField);
            String identity = text(element, identityField);
            if (address == null || identity == null) {
                continue;
            }
            byIdentity.putIfAbsent(identity, new ScanTarget(address, identity));
        }

        List<ScanTarget> targets = new ArrayList<>(byIdentity.values());
        log.info("Found {} unique identities with addresses in {}", targets.size(), snapshot.getFileName());
        if (limit > 0 && targets.size() > limit) {
            log.info("Limiting scan to first {} targets", limit);
            return List.copyOf(targets.subList(0, limit));
        }
        return targets;
    }

    private static String text(JsonNode element, String field) {
        JsonNode value = element.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
