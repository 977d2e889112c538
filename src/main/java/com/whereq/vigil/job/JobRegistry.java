package com.whereq.vigil.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.config.VigilProperties.JobConfig;
import com.whereq.vigil.exception.UnknownJobException;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import com.whereq.vigil.scan.ScanEngine;
import com.whereq.vigil.scan.TargetProbe;
import com.whereq.vigil.sink.RecordSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static job registry built from {@code vigil.jobs}. Registration order is the order
 * "all" runs and reports jobs in.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<String, JobDefinition> jobs;

    @Autowired
    public JobRegistry(VigilProperties properties, TimeoutGuardedExecutor executor, RecordSink sink,
                       ScanEngine scanEngine, TargetProbe probe, ObjectMapper objectMapper) {
        SnapshotStore store = new SnapshotStore(objectMapper, properties.getFetch().getMinBytes());
        Map<String, JobDefinition> definitions = new LinkedHashMap<>();

        properties.getJobs().forEach((name, config) -> {
            Path snapshot = snapshotPath(properties, name, config);
            Duration fetchTimeout = config.getFetchTimeout() != null
                ? config.getFetchTimeout()
                : properties.getFetch().getTimeout();

            FetchStep fetchStep = config.getFetchCommand().isEmpty()
                ? null
                : new CommandSnapshotFetcher(config.getFetchCommand(), snapshot, fetchTimeout, store, executor);

            ProcessStep processStep = switch (config.getKind()) {
                case SNAPSHOT -> SnapshotUpsertStep.builder()
                    .table(config.getTable() != null ? config.getTable() : name)
                    .identityField(config.getIdentityField())
                    .recordsPath(config.getRecordsPath())
                    .requiredFields(List.copyOf(config.getRequiredFields()))
                    .batchSize(properties.getSink().getBatchSize())
                    .defaultSnapshot(snapshot)
                    .store(store)
                    .sink(sink)
                    .objectMapper(objectMapper)
                    .build();
                case COMMAND -> {
                    if (config.getProcessCommand().isEmpty()) {
                        throw new IllegalStateException("Job " + name + " needs a process-command");
                    }
                    yield new CommandProcessStep(config.getProcessCommand(), snapshot, config.getTimeout(), executor);
                }
                case SCAN -> new PortScanStep(
                    config.getTable() != null ? config.getTable() : name,
                    targetSource(properties, name, config, store),
                    probe,
                    scanEngine,
                    properties);
            };

            definitions.put(name, JobDefinition.builder()
                .name(name)
                .kind(config.getKind())
                .fetchStep(fetchStep)
                .processStep(processStep)
                .fetchTimeout(fetchTimeout)
                .processTimeout(config.getTimeout())
                .build());
        });

        this.jobs = Collections.unmodifiableMap(definitions);
        log.info("Registered jobs: {}", String.join(", ", jobs.keySet()));
    }

    public JobRegistry(List<JobDefinition> definitions) {
        Map<String, JobDefinition> byName = new LinkedHashMap<>();
        definitions.forEach(definition -> byName.put(definition.getName(), definition));
        this.jobs = Collections.unmodifiableMap(byName);
    }

    public JobDefinition get(String name) {
        JobDefinition definition = jobs.get(name);
        if (definition == null) {
            throw new UnknownJobException(name);
        }
        return definition;
    }

    public boolean contains(String name) {
        return jobs.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(jobs.keySet());
    }

    private static SnapshotTargetSource targetSource(VigilProperties properties, String name, JobConfig config,
                                                     SnapshotStore store) {
        String source = config.getTargetsFrom();
        if (source == null) {
            throw new IllegalStateException("Scan job " + name + " needs targets-from");
        }
        JobConfig sourceConfig = properties.getJobs().get(source);
        if (sourceConfig == null) {
            throw new IllegalStateException("Scan job " + name + " reads targets from unknown job " + source);
        }
        return new SnapshotTargetSource(
            snapshotPath(properties, source, sourceConfig),
            sourceConfig.getRecordsPath(),
            config.getAddressField(),
            config.getIdentityField(),
            config.getLimit(),
            store);
    }

    private static Path snapshotPath(VigilProperties properties, String name, JobConfig config) {
        String file = config.getSnapshot() != null ? config.getSnapshot() : name + "_data.json";
        return properties.getDataDir().resolve(file);
    }
}
