package com.whereq.tessera.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Normalized tabular result of a SUCCEEDED job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {
    private List<Column> columns;
    private List<List<Object>> rows;
    private ExecutionStats stats;
}
