package com.whereq.herald.store;

import com.whereq.herald.config.HeraldProperties;
import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for development and tests. Nothing survives a restart.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "herald.store", name = "type", havingValue = "memory")
public class InMemoryNotificationStore implements NotificationStore {

    private final ConcurrentHashMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Deque<HistoryEntry> history = new ArrayDeque<>();
    private final int historyMaxEntries;

    @Autowired
    public InMemoryNotificationStore(HeraldProperties properties) {
        this(properties.getStore().getHistoryMaxEntries());
    }

    public InMemoryNotificationStore(int historyMaxEntries) {
        this.historyMaxEntries = historyMaxEntries;
        log.warn("Using in-memory notification store: scheduled jobs will not survive a restart");
    }

    @Override
    public Flux<ScheduledJob> loadAll() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(jobs.values())))
            .map(ScheduledJob::copy);
    }

    @Override
    public Flux<HistoryEntry> loadHistory(int limit) {
        return Flux.defer(() -> {
            List<HistoryEntry> snapshot;
            synchronized (history) {
                snapshot = new ArrayList<>(history);
            }
            return Flux.fromIterable(snapshot).take(Math.max(0, limit));
        });
    }

    @Override
    public Mono<Void> upsertJob(ScheduledJob job) {
        return Mono.fromRunnable(() -> jobs.put(job.getId(), job.copy()));
    }

    @Override
    public Mono<Void> appendHistory(HistoryEntry entry) {
        return Mono.fromRunnable(() -> {
            synchronized (history) {
                history.addFirst(entry);
                while (history.size() > historyMaxEntries) {
                    history.removeLast();
                }
            }
        });
    }

    @Override
    public Mono<Void> deleteJob(String jobId) {
        return Mono.fromRunnable(() -> jobs.remove(jobId));
    }
}
