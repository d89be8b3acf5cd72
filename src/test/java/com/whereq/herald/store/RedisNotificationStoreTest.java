package com.whereq.herald.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.herald.config.HeraldProperties;
import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.Priority;
import com.whereq.herald.model.RecurrenceRule;
import com.whereq.herald.model.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveListOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveSetOperations;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisNotificationStoreTest {

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOps;

    @Mock
    private ReactiveSetOperations<String, String> setOps;

    @Mock
    private ReactiveListOperations<String, String> listOps;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private RedisNotificationStore store;

    @BeforeEach
    void setUp() {
        HeraldProperties properties = new HeraldProperties();
        properties.getStore().setHistoryMaxEntries(50);
        store = new RedisNotificationStore(redisTemplate, objectMapper, properties);
    }

    @Test
    void keys_arePrefixed() {
        assertThat(store.jobKey("j1")).isEqualTo("herald:job:j1");
        assertThat(store.indexKey()).isEqualTo("herald:jobs");
        assertThat(store.historyKey()).isEqualTo("herald:history");
    }

    @Test
    void upsert_writesJsonRecordAndIndexesId() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        when(valueOps.set(eq("herald:job:j1"), anyString())).thenReturn(Mono.just(true));
        when(setOps.add("herald:jobs", "j1")).thenReturn(Mono.just(1L));
        ScheduledJob job = job("j1");

        StepVerifier.create(store.upsertJob(job)).verifyComplete();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("herald:job:j1"), json.capture());
        assertThat(objectMapper.readValue(json.getValue(), ScheduledJob.class)).isEqualTo(job);
        verify(setOps).add("herald:jobs", "j1");
    }

    @Test
    void appendHistory_pushesNewestFirstAndTrims() throws Exception {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(listOps.leftPush(eq("herald:history"), anyString())).thenReturn(Mono.just(1L));
        when(listOps.trim("herald:history", 0, 49)).thenReturn(Mono.just(true));
        HistoryEntry entry = HistoryEntry.builder()
            .id("h1")
            .jobId("j1")
            .firedAt(Instant.parse("2024-01-01T10:00:00Z"))
            .success(false)
            .errorDetail("timed out")
            .destinationEcho("/hooks/team")
            .build();

        StepVerifier.create(store.appendHistory(entry)).verifyComplete();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(listOps).leftPush(eq("herald:history"), json.capture());
        assertThat(objectMapper.readValue(json.getValue(), HistoryEntry.class)).isEqualTo(entry);
        verify(listOps).trim("herald:history", 0, 49);
    }

    @Test
    void loadAll_skipsMissingAndUnreadableRecords() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        when(setOps.members("herald:jobs")).thenReturn(Flux.just("a", "b", "c"));
        when(valueOps.get("herald:job:a")).thenReturn(Mono.just(objectMapper.writeValueAsString(job("a"))));
        when(valueOps.get("herald:job:b")).thenReturn(Mono.empty());
        when(valueOps.get("herald:job:c")).thenReturn(Mono.just("{not json"));

        StepVerifier.create(store.loadAll())
            .assertNext(job -> {
                assertThat(job.getId()).isEqualTo("a");
                assertThat(job.getRecurrence()).isEqualTo(RecurrenceRule.daily(1));
                assertThat(job.getPayload().getMetadata()).containsEntry("team", "ops");
            })
            .verifyComplete();
    }

    @Test
    void loadHistory_readsRequestedRange() throws Exception {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        HistoryEntry entry = HistoryEntry.builder().id("h1").success(true).build();
        when(listOps.range("herald:history", 0, 4))
            .thenReturn(Flux.just(objectMapper.writeValueAsString(entry)));

        StepVerifier.create(store.loadHistory(5))
            .expectNext(entry)
            .verifyComplete();
    }

    @Test
    void loadHistory_nonPositiveLimitReadsNothing() {
        StepVerifier.create(store.loadHistory(0)).verifyComplete();
    }

    @Test
    void delete_removesRecordAndIndexEntry() {
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        when(redisTemplate.delete("herald:job:j1")).thenReturn(Mono.just(1L));
        when(setOps.remove("herald:jobs", "j1")).thenReturn(Mono.just(1L));

        StepVerifier.create(store.deleteJob("j1")).verifyComplete();

        verify(redisTemplate).delete("herald:job:j1");
        verify(setOps).remove("herald:jobs", "j1");
    }

    @Test
    void redisErrors_propagate() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        when(valueOps.set(eq("herald:job:j1"), anyString()))
            .thenReturn(Mono.error(new IllegalStateException("READONLY")));
        when(setOps.add("herald:jobs", "j1")).thenReturn(Mono.just(1L));

        StepVerifier.create(store.upsertJob(job("j1")))
            .expectErrorMessage("READONLY")
            .verify();
    }

    private static ScheduledJob job(String id) {
        return ScheduledJob.builder()
            .id(id)
            .payload(NotificationPayload.builder()
                .title("Standup")
                .message("Daily standup in 5 minutes")
                .destination("/hooks/team")
                .priority(Priority.HIGH)
                .metadata(Map.of("team", "ops"))
                .build())
            .firstFireTime(Instant.parse("2024-01-01T09:55:00Z"))
            .nextFireTime(Instant.parse("2024-01-02T09:55:00Z"))
            .lastFireTime(Instant.parse("2024-01-01T09:55:00Z"))
            .recurrence(RecurrenceRule.daily(1))
            .active(true)
            .createdTime(Instant.parse("2023-12-31T12:00:00Z"))
            .build();
    }
}
