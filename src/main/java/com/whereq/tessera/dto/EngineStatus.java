package com.whereq.tessera.dto;

import com.whereq.tessera.model.EngineDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Live figures for one engine
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatus {
    private String engineId;
    private Set<String> aliases;
    private int maxConcurrency;
    private Set<EngineDescriptor.Capability> capabilities;

    /** Jobs waiting for a worker */
    private long queued;

    /** Jobs executing now */
    private int running;

    /** Whether SELECT 1 succeeded */
    private boolean reachable;
}
