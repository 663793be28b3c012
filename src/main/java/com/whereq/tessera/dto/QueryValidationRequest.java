package com.whereq.tessera.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to check a query without running it
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryValidationRequest {

    @NotBlank(message = "queryText is required")
    @Schema(description = "SQL to check", example = "SELECT 1")
    private String queryText;

    @Schema(description = "Engine id or alias", example = "duckdb")
    @Builder.Default
    private String engineId = "duckdb";
}
