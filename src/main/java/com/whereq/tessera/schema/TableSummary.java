package com.whereq.tessera.schema;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TableSummary {
    String tableName;
    int currentVersion;
    int totalVersions;
    int fieldCount;
    Instant createdAt;
    Instant lastUpdated;
}
