package com.whereq.tessera.service;

import com.whereq.tessera.config.TesseraProperties;
import com.whereq.tessera.exception.QuotaExceededException;
import com.whereq.tessera.queue.JobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Admission control for job submissions
 * Rejects a submission when the target engine's queue is full
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionController {

    private final TesseraProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Admit a job onto an engine queue
     *
     * @param queue the target engine queue
     * @return Mono that completes when admitted, or fails with {@link QuotaExceededException}
     */
    public Mono<Void> admit(JobQueue queue) {
        long maxQueueSize = properties.getJobs().getMaxQueueSize();
        return queue.isFull(maxQueueSize)
            .flatMap(isFull -> {
                if (isFull) {
                    rejectedCounter(queue.getEngineId()).increment();
                    log.warn("Submission to {} rejected: queue is full (size >= {})", queue.getEngineId(), maxQueueSize);
                    return Mono.error(new QuotaExceededException(
                        "Queue for engine " + queue.getEngineId() + " is full (" + maxQueueSize + " jobs waiting)"));
                }
                return Mono.empty();
            });
    }

    private Counter rejectedCounter(String engineId) {
        return Counter.builder("tessera.admission.rejected")
            .description("Number of jobs rejected due to full queue")
            .tag("engine", engineId)
            .register(meterRegistry);
    }
}
