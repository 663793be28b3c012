package com.whereq.tessera.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to run a query on an engine
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitRequest {

    @NotBlank(message = "queryText is required")
    @Schema(description = "SQL to execute", example = "SELECT 1")
    private String queryText;

    @NotBlank(message = "engineId is required")
    @Schema(description = "Engine id or alias", example = "embedded")
    private String engineId;
}
