package com.whereq.tessera.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Static, process-wide description of an engine adapter.
 */
@Value
@Builder
public class EngineDescriptor {
    /** Canonical engine id, also the key of compiled DDL */
    String engineId;

    /** Alternative ids accepted on submission */
    @Singular("alias")
    Set<String> aliases;

    /** Upper bound on concurrently executing jobs */
    int maxConcurrency;

    @Singular("capability")
    Set<Capability> capabilities;

    public enum Capability {
        EXECUTE,
        CANCEL,
        DESCRIBE_STATS
    }
}
