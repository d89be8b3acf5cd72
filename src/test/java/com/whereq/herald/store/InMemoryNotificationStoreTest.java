package com.whereq.herald.store;

import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.JobStatus;
import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.ScheduledJob;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryNotificationStoreTest {

    private final InMemoryNotificationStore store = new InMemoryNotificationStore(3);

    @Test
    void upsert_replacesPreviousRecord() {
        ScheduledJob job = job("j1");
        store.upsertJob(job).block();

        job.transitionTo(JobStatus.PAUSED);
        store.upsertJob(job).block();

        StepVerifier.create(store.loadAll())
            .assertNext(loaded -> assertThat(loaded.getStatus()).isEqualTo(JobStatus.PAUSED))
            .verifyComplete();
    }

    @Test
    void storedRecords_areIsolatedFromCallerMutation() {
        ScheduledJob job = job("j1");
        store.upsertJob(job).block();

        job.setNextFireTime(Instant.EPOCH);
        store.loadAll().blockFirst().setActive(false);

        ScheduledJob loaded = store.loadAll().blockFirst();
        assertThat(loaded.getNextFireTime()).isEqualTo(Instant.parse("2024-01-01T10:00:00Z"));
        assertThat(loaded.isActive()).isTrue();
    }

    @Test
    void delete_removesRecord() {
        store.upsertJob(job("j1")).block();
        store.upsertJob(job("j2")).block();

        store.deleteJob("j1").block();

        StepVerifier.create(store.loadAll().map(ScheduledJob::getId))
            .expectNext("j2")
            .verifyComplete();
    }

    @Test
    void history_isNewestFirstAndCapped() {
        for (int i = 1; i <= 5; i++) {
            store.appendHistory(entry("h" + i)).block();
        }

        StepVerifier.create(store.loadHistory(10).map(HistoryEntry::getId))
            .expectNext("h5", "h4", "h3")
            .verifyComplete();
    }

    @Test
    void history_respectsLimit() {
        store.appendHistory(entry("h1")).block();
        store.appendHistory(entry("h2")).block();

        StepVerifier.create(store.loadHistory(1).map(HistoryEntry::getId))
            .expectNext("h2")
            .verifyComplete();
        StepVerifier.create(store.loadHistory(0)).verifyComplete();
    }

    private static ScheduledJob job(String id) {
        return ScheduledJob.builder()
            .id(id)
            .payload(NotificationPayload.builder().title(id).message("m").destination("/d").build())
            .firstFireTime(Instant.parse("2024-01-01T10:00:00Z"))
            .nextFireTime(Instant.parse("2024-01-01T10:00:00Z"))
            .active(true)
            .createdTime(Instant.parse("2024-01-01T09:00:00Z"))
            .build();
    }

    private static HistoryEntry entry(String id) {
        return HistoryEntry.builder()
            .id(id)
            .jobId("j1")
            .firedAt(Instant.parse("2024-01-01T10:00:00Z"))
            .success(true)
            .destinationEcho("/d")
            .build();
    }
}
