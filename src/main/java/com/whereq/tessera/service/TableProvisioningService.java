package com.whereq.tessera.service;

import com.whereq.tessera.dto.CreateTablesResponse;
import com.whereq.tessera.engine.EngineRegistry;
import com.whereq.tessera.schema.SchemaDefinition;
import com.whereq.tessera.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the tables of a schema version by submitting its compiled DDL
 * as ordinary jobs, one per engine with a registered adapter
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableProvisioningService {

    private final SchemaRegistry schemaRegistry;
    private final EngineRegistry engineRegistry;
    private final JobManager jobManager;

    /**
     * @param tableName logical table name
     * @param version schema version, or null for the current one
     */
    public Mono<CreateTablesResponse> createTables(String tableName, Integer version) {
        return Mono.fromCallable(() -> version == null
                ? schemaRegistry.getCurrent(tableName)
                : schemaRegistry.getVersion(tableName, version))
            .flatMap(this::submitDdl);
    }

    private Mono<CreateTablesResponse> submitDdl(SchemaDefinition definition) {
        List<String> skipped = new ArrayList<>();
        List<Map.Entry<String, String>> targets = new ArrayList<>();
        definition.getCompiledDdl().forEach((engineId, ddl) -> {
            if (engineRegistry.find(engineId).isPresent()) {
                targets.add(Map.entry(engineId, ddl));
            } else {
                skipped.add(engineId);
            }
        });

        return Flux.fromIterable(targets)
            .concatMap(target -> jobManager.submit(target.getValue(), target.getKey())
                .map(job -> Map.entry(target.getKey(), job.getId())))
            .collect(LinkedHashMap<String, String>::new, (jobs, entry) -> jobs.put(entry.getKey(), entry.getValue()))
            .map(jobs -> {
                log.info("Submitted DDL for {} v{} to {} (skipped {})",
                    definition.getTableName(), definition.getVersion(), jobs.keySet(), skipped);
                return CreateTablesResponse.builder()
                    .tableName(definition.getTableName())
                    .version(definition.getVersion())
                    .jobs(jobs)
                    .skipped(skipped)
                    .build();
            });
    }
}
