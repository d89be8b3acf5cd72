package com.whereq.herald.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.herald.config.HeraldProperties;
import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis-backed store.
 *
 * Layout:
 *  - {prefix}:job:{id}  one JSON document per job (SET replaces it atomically)
 *  - {prefix}:jobs      set of known job ids
 *  - {prefix}:history   list of JSON history entries, newest first, trimmed to the retention cap
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "herald.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisNotificationStore implements NotificationStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final int historyMaxEntries;

    public RedisNotificationStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                  ObjectMapper objectMapper,
                                  HeraldProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getStore().getKeyPrefix();
        this.historyMaxEntries = properties.getStore().getHistoryMaxEntries();
    }

    @Override
    public Flux<ScheduledJob> loadAll() {
        return redisTemplate.opsForSet().members(indexKey())
            .concatMap(id -> redisTemplate.opsForValue().get(jobKey(id))
                .switchIfEmpty(Mono.fromRunnable(() ->
                    log.warn("Job {} is indexed but has no record", id))))
            .concatMap(json -> read(json, ScheduledJob.class));
    }

    @Override
    public Flux<HistoryEntry> loadHistory(int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return redisTemplate.opsForList().range(historyKey(), 0, limit - 1L)
            .concatMap(json -> read(json, HistoryEntry.class));
    }

    @Override
    public Mono<Void> upsertJob(ScheduledJob job) {
        return write(job)
            .flatMap(json -> redisTemplate.opsForValue().set(jobKey(job.getId()), json))
            .then(redisTemplate.opsForSet().add(indexKey(), job.getId()))
            .doOnSuccess(added -> log.debug("Persisted job {} ({})", job.getId(), job.getStatus()))
            .then();
    }

    @Override
    public Mono<Void> appendHistory(HistoryEntry entry) {
        return write(entry)
            .flatMap(json -> redisTemplate.opsForList().leftPush(historyKey(), json))
            .then(redisTemplate.opsForList().trim(historyKey(), 0, historyMaxEntries - 1L))
            .then();
    }

    @Override
    public Mono<Void> deleteJob(String jobId) {
        return redisTemplate.delete(jobKey(jobId))
            .then(redisTemplate.opsForSet().remove(indexKey(), jobId))
            .doOnSuccess(removed -> log.info("Deleted job record {}", jobId))
            .then();
    }

    private Mono<String> write(Object value) {
        return Mono.fromCallable(() -> {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
            }
        });
    }

    private <T> Mono<T> read(String json, Class<T> type) {
        try {
            return Mono.just(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("Skipping unreadable {} record", type.getSimpleName(), e);
            return Mono.empty();
        }
    }

    String jobKey(String jobId) {
        return keyPrefix + ":job:" + jobId;
    }

    String indexKey() {
        return keyPrefix + ":jobs";
    }

    String historyKey() {
        return keyPrefix + ":history";
    }
}
