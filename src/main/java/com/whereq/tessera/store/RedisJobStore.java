package com.whereq.tessera.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tessera.config.TesseraProperties;
import com.whereq.tessera.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Job snapshots stored in Redis as JSON, one key per job.
 * Keys expire after the retention period, which replaces explicit eviction.
 * Uses the string template auto-configured by Spring Boot.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tessera.store", name = "type", havingValue = "redis")
public class RedisJobStore implements JobStore {

    private static final String KEY_PREFIX = "tessera:job:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisJobStore(ReactiveStringRedisTemplate redisTemplate,
                         ObjectMapper objectMapper,
                         TesseraProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = properties.getStore().getRetention();
    }

    @Override
    public Mono<Job> save(Job job) {
        return findById(job.getId())
            .filter(existing -> existing.getState().isTerminal() && !job.getState().isTerminal())
            .switchIfEmpty(Mono.defer(() -> redisTemplate.opsForValue()
                .set(KEY_PREFIX + job.getId(), write(job), ttl)
                .doOnSuccess(ok -> log.debug("Job {} stored in Redis: {}", job.getId(), job.getState()))
                .thenReturn(job)));
    }

    @Override
    public Mono<Job> findById(String jobId) {
        return redisTemplate.opsForValue()
            .get(KEY_PREFIX + jobId)
            .map(this::read);
    }

    @Override
    public Flux<Job> findAll() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(KEY_PREFIX + "*").build())
            .flatMap(key -> redisTemplate.opsForValue().get(key))
            .map(this::read);
    }

    @Override
    public Mono<Long> deleteFinishedBefore(Instant cutoff) {
        // key TTL already removes expired jobs
        return Mono.just(0L);
    }

    private String write(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getId(), e);
        }
    }

    private Job read(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored job", e);
        }
    }
}
