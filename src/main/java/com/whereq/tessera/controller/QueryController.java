package com.whereq.tessera.controller;

import com.whereq.tessera.dto.QueryValidationRequest;
import com.whereq.tessera.dto.QueryValidationResponse;
import com.whereq.tessera.engine.EngineException;
import com.whereq.tessera.exception.UnknownEngineException;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.service.QueryValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Query checks that run nothing
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/queries")
@Tag(name = "Queries", description = "Validate SQL without executing it")
public class QueryController {

    @Autowired
    private QueryValidationService validationService;

    @PostMapping("/validate")
    @Operation(summary = "Validate a query", description = "Parses and plans the query on the engine; nothing is executed")
    public Mono<ResponseEntity<QueryValidationResponse>> validate(@Valid @RequestBody QueryValidationRequest request) {
        String engineId = request.getEngineId();

        return validationService.validate(request.getQueryText(), engineId)
            .map(validation -> ResponseEntity.ok(QueryValidationResponse.from(validation)))
            .onErrorResume(UnknownEngineException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(QueryValidationResponse.error(engineId, ErrorKind.UNKNOWN_ENGINE, e.getMessage()))))
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(QueryValidationResponse.error(engineId, null, e.getMessage()))))
            .onErrorResume(EngineException.class, e -> {
                log.warn("Validation on {} could not run: [{}] {}", engineId, e.getKind(), e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(QueryValidationResponse.error(engineId, e.getKind(), e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error validating query on {}", engineId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(QueryValidationResponse.error(engineId, null, "Internal server error: " + e.getMessage())));
            });
    }
}
