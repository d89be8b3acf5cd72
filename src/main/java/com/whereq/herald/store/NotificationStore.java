package com.whereq.herald.store;

import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.ScheduledJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable mirror of the scheduler's job table and delivery history.
 * Writes are per record: concurrent upserts of different jobs never overwrite each other.
 */
public interface NotificationStore {

    /**
     * Load every persisted job
     *
     * @return Flux of jobs, in no particular order
     */
    Flux<ScheduledJob> loadAll();

    /**
     * Load the most recent history entries
     *
     * @param limit maximum number of entries
     * @return Flux of entries, most recent first
     */
    Flux<HistoryEntry> loadHistory(int limit);

    /**
     * Insert or replace a job record
     *
     * @param job the job to persist
     * @return Mono that completes when the record is written
     */
    Mono<Void> upsertJob(ScheduledJob job);

    /**
     * Append a history entry; older entries beyond the retention cap may be dropped
     *
     * @param entry the entry to append
     * @return Mono that completes when the entry is written
     */
    Mono<Void> appendHistory(HistoryEntry entry);

    /**
     * Remove a job record
     *
     * @param jobId the job identifier
     * @return Mono that completes when the record is removed
     */
    Mono<Void> deleteJob(String jobId);
}
