package com.whereq.tessera.controller;

import com.whereq.tessera.dto.SystemStatusResponse;
import com.whereq.tessera.service.JobManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Engine and system status.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/engines")
@Tag(name = "Engines", description = "Registered engines and their load")
public class EngineController {

    @Autowired
    private JobManager jobManager;

    @GetMapping
    @Operation(summary = "System status", description = "Per-engine queue, workers and reachability, plus job counts")
    public Mono<ResponseEntity<SystemStatusResponse>> status() {
        return jobManager.systemStatus()
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Failed to collect system status", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }
}
