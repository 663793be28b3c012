package com.whereq.tessera.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Engine-native result handed to the normalizer
 */
@Value
@Builder
public class RawResult {
    List<RawColumn> columns;

    /** Driver values, one list per row, in column order */
    List<List<Object>> rows;

    long wallTimeMs;

    /** Null when the engine does not report it */
    Long rowsScanned;

    /** Null when plan capture is disabled or unsupported */
    String planText;
}
