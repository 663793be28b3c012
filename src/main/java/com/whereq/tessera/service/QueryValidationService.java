package com.whereq.tessera.service;

import com.whereq.tessera.engine.EngineAdapter;
import com.whereq.tessera.engine.EngineRegistry;
import com.whereq.tessera.model.QueryValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Dry runs of queries. Validation bypasses the job queue and borrows a
 * connection directly, so on a single-connection engine it waits for the
 * running job to release it.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryValidationService {

    private final EngineRegistry engineRegistry;

    /**
     * Check a query on an engine without executing it
     *
     * @param queryText SQL text
     * @param engineId canonical engine id or alias
     * @return Mono with the verdict; errors with UnknownEngineException for an
     *         unknown id and EngineException when the engine cannot be reached
     */
    public Mono<QueryValidation> validate(String queryText, String engineId) {
        return Mono.defer(() -> {
            if (queryText == null || queryText.isBlank()) {
                return Mono.error(new IllegalArgumentException("queryText must not be blank"));
            }
            EngineAdapter adapter = engineRegistry.resolve(engineId);

            return Mono.fromCallable(() -> adapter.validate(queryText))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(result -> log.info("Validated {} query on {}: {}",
                    result.getQueryType(), result.getEngineId(), result.isValid() ? "valid" : "invalid"));
        });
    }
}
