package com.whereq.tessera.dto;

import com.whereq.tessera.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatusResponse {
    private List<EngineStatus> engines;
    private Map<JobState, Long> jobCounts;
    private Instant timestamp;
}
