package com.whereq.tessera.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Jobs submitted to create a schema version's tables
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTablesResponse {
    private String tableName;
    private int version;

    /** Engine id to DDL job id */
    private Map<String, String> jobs;

    /** Engines with compiled DDL but no registered adapter */
    private List<String> skipped;
}
