package com.whereq.tessera.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical execution statistics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStats {
    /**
     * Wall-clock execution time on the engine
     */
    private long wallTimeMs;

    /**
     * Rows in the normalized result
     */
    private long rowsReturned;

    /**
     * Rows read by the engine, null when the engine does not report it
     */
    private Long rowsScanned;

    /**
     * Engine plan text, null when plan capture is unsupported or disabled
     */
    private String planText;
}
