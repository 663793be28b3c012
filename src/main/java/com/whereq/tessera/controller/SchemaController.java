package com.whereq.tessera.controller;

import com.whereq.tessera.dto.CreateTablesResponse;
import com.whereq.tessera.dto.SchemaRegisterRequest;
import com.whereq.tessera.dto.SchemaResponse;
import com.whereq.tessera.exception.NotFoundException;
import com.whereq.tessera.exception.QuotaExceededException;
import com.whereq.tessera.exception.SchemaValidationException;
import com.whereq.tessera.exception.UnknownEngineException;
import com.whereq.tessera.exception.UnsupportedTypeException;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.schema.BigQuerySchemaParser;
import com.whereq.tessera.schema.FlattenedView;
import com.whereq.tessera.schema.SchemaField;
import com.whereq.tessera.schema.SchemaRegistry;
import com.whereq.tessera.schema.SchemaVersionInfo;
import com.whereq.tessera.schema.TableSummary;
import com.whereq.tessera.service.TableProvisioningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Controller for versioned schema definitions
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/schemas")
@Tag(name = "Schemas", description = "Register schemas and read compiled DDL")
public class SchemaController {

    @Autowired
    private SchemaRegistry schemaRegistry;

    @Autowired
    private BigQuerySchemaParser schemaParser;

    @Autowired
    private TableProvisioningService tableProvisioningService;

    @PostMapping
    @Operation(summary = "Register a schema version", description = "Compiles DDL for every dialect and stores a new version")
    public Mono<ResponseEntity<SchemaResponse>> register(@Valid @RequestBody SchemaRegisterRequest request) {
        return register(request.getTableName(), request.getFields(), request.getDescription());
    }

    @PostMapping(path = "/{tableName}/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Register from a file", description = "Accepts a BigQuery JSON schema (.json or .schema)")
    public Mono<ResponseEntity<SchemaResponse>> upload(
            @PathVariable String tableName,
            @RequestPart("file") FilePart file,
            @RequestParam(required = false) String description) {

        String filename = file.filename().toLowerCase(Locale.ROOT);
        if (!filename.endsWith(".json") && !filename.endsWith(".schema")) {
            return Mono.just(ResponseEntity.badRequest().body(SchemaResponse.error(tableName,
                "INVALID_SCHEMA", "Unsupported schema file '" + file.filename() + "', expected .json or .schema")));
        }

        return DataBufferUtils.join(file.content())
            .map(buffer -> {
                byte[] bytes = new byte[buffer.readableByteCount()];
                buffer.read(bytes);
                DataBufferUtils.release(buffer);
                return bytes;
            })
            .map(schemaParser::parse)
            .flatMap(fields -> register(tableName, fields, description != null ? description : "Uploaded from " + file.filename()))
            .onErrorResume(SchemaValidationException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(SchemaResponse.error(tableName, "INVALID_SCHEMA", e.getMessage()))));
    }

    @GetMapping
    @Operation(summary = "List tables", description = "One summary per registered table")
    public Mono<ResponseEntity<List<TableSummary>>> listTables() {
        return Mono.fromCallable(schemaRegistry::listTables)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{tableName}")
    @Operation(summary = "Current schema version")
    public Mono<ResponseEntity<SchemaResponse>> getCurrent(@PathVariable String tableName) {
        return Mono.fromCallable(() -> schemaRegistry.getCurrent(tableName))
            .map(definition -> ResponseEntity.ok(SchemaResponse.from(definition)))
            .onErrorResume(NotFoundException.class, e -> notFound(tableName, e));
    }

    @GetMapping("/{tableName}/versions")
    @Operation(summary = "List versions", description = "Version metadata, oldest first")
    public Mono<ResponseEntity<List<SchemaVersionInfo>>> listVersions(@PathVariable String tableName) {
        return Mono.fromCallable(() -> schemaRegistry.listVersions(tableName))
            .map(ResponseEntity::ok)
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }

    @GetMapping("/{tableName}/versions/{version}")
    @Operation(summary = "Specific schema version")
    public Mono<ResponseEntity<SchemaResponse>> getVersion(@PathVariable String tableName, @PathVariable int version) {
        return Mono.fromCallable(() -> schemaRegistry.getVersion(tableName, version))
            .map(definition -> ResponseEntity.ok(SchemaResponse.from(definition)))
            .onErrorResume(NotFoundException.class, e -> notFound(tableName, e));
    }

    @GetMapping("/{tableName}/flattened-view")
    @Operation(summary = "Flattened view SQL",
        description = "CREATE VIEW lifting nested RECORD members into dotted columns; 404 when nothing is nested")
    public Mono<ResponseEntity<FlattenedView>> flattenedView(
            @PathVariable String tableName,
            @RequestParam(name = "engine", defaultValue = "duckdb") String engineId,
            @RequestParam(required = false) Integer version) {

        return Mono.fromCallable(() -> schemaRegistry.flattenedView(tableName, version, engineId))
            .map(ResponseEntity::ok)
            .onErrorResume(NotFoundException.class, e -> {
                log.debug("No flattened view for {}: {}", tableName, e.getMessage());
                return Mono.just(ResponseEntity.notFound().build());
            })
            .onErrorResume(UnknownEngineException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @PostMapping("/{tableName}/tables")
    @Operation(summary = "Create tables", description = "Submit the compiled DDL of a version as one job per available engine")
    public Mono<ResponseEntity<CreateTablesResponse>> createTables(
            @PathVariable String tableName,
            @RequestParam(required = false) Integer version) {

        return tableProvisioningService.createTables(tableName, version)
            .map(response -> ResponseEntity.status(HttpStatus.ACCEPTED).body(response))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(QuotaExceededException.class, e -> {
                log.error("Quota exceeded while creating tables for {}: {}", tableName, e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).build());
            });
    }

    private Mono<ResponseEntity<SchemaResponse>> register(String tableName, List<SchemaField> fields, String description) {
        return Mono.fromCallable(() -> schemaRegistry.register(tableName, fields, description))
            .map(definition -> ResponseEntity
                .created(URI.create("/api/v1/schemas/" + tableName + "/versions/" + definition.getVersion()))
                .body(SchemaResponse.from(definition)))
            .onErrorResume(SchemaValidationException.class, e -> {
                log.warn("Invalid schema for {}: {}", tableName, e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(SchemaResponse.error(tableName, "INVALID_SCHEMA", e.getMessage())));
            })
            .onErrorResume(UnsupportedTypeException.class, e -> {
                log.warn("Schema {} rejected: {}", tableName, e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(SchemaResponse.error(tableName, ErrorKind.UNSUPPORTED_TYPE.name(), e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error registering schema {}", tableName, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(SchemaResponse.error(tableName, null, "Internal server error: " + e.getMessage())));
            });
    }

    private static Mono<ResponseEntity<SchemaResponse>> notFound(String tableName, NotFoundException e) {
        return Mono.just(ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(SchemaResponse.error(tableName, ErrorKind.NOT_FOUND.name(), e.getMessage())));
    }
}
