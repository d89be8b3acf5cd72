package com.whereq.herald.service;

import com.whereq.herald.clock.Clock;
import com.whereq.herald.config.HeraldProperties;
import com.whereq.herald.dispatch.Dispatcher;
import com.whereq.herald.exception.CannotResumeCompletedJobException;
import com.whereq.herald.exception.InvalidRecurrenceRuleException;
import com.whereq.herald.exception.PastScheduleTimeException;
import com.whereq.herald.exception.StoreFailureException;
import com.whereq.herald.model.DispatchResult;
import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.JobStatus;
import com.whereq.herald.model.NotificationPayload;
import com.whereq.herald.model.RecurrenceRule;
import com.whereq.herald.model.ScheduledJob;
import com.whereq.herald.recurrence.RecurrenceCalculator;
import com.whereq.herald.store.NotificationStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Exceptions;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the job table and runs the firing protocol.
 *
 * Locking:
 *  - tableLock: structural changes to the table (insert, remove)
 *  - per-job stateLock: every read-modify-write of a job's fields, and every store write for that job
 *  - per-job firingLock: at most one firing protocol per job at a time
 *
 * The state lock is released while the dispatcher runs, so cancel/pause never wait for an
 * in-flight delivery. Each armed timer carries a generation number; disarming bumps it, which
 * turns any timer that already elapsed into a no-op.
 */
@Slf4j
@Service
public class NotificationScheduler {

    private final NotificationStore store;
    private final Dispatcher dispatcher;
    private final RecurrenceCalculator recurrenceCalculator;
    private final Clock clock;
    private final Duration storeTimeout;
    private final Duration dispatchTimeout;

    private final ConcurrentHashMap<String, JobSlot> jobs = new ConcurrentHashMap<>();
    private final ReentrantLock tableLock = new ReentrantLock();
    private final AtomicBoolean recovered = new AtomicBoolean(false);

    private final Counter dispatchSucceeded;
    private final Counter dispatchFailed;
    private final Counter storeFailures;
    private final Counter catchUps;

    public NotificationScheduler(NotificationStore store,
                                 Dispatcher dispatcher,
                                 RecurrenceCalculator recurrenceCalculator,
                                 Clock clock,
                                 HeraldProperties properties,
                                 MeterRegistry meterRegistry) {
        this.store = Objects.requireNonNull(store);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.recurrenceCalculator = Objects.requireNonNull(recurrenceCalculator);
        this.clock = Objects.requireNonNull(clock);
        this.storeTimeout = properties.getStore().getTimeout();
        this.dispatchTimeout = properties.getDispatch().getTimeout();

        dispatchSucceeded = Counter.builder("herald.dispatch.succeeded")
            .description("Number of notifications delivered")
            .register(meterRegistry);

        dispatchFailed = Counter.builder("herald.dispatch.failed")
            .description("Number of failed delivery attempts")
            .register(meterRegistry);

        storeFailures = Counter.builder("herald.store.failures")
            .description("Number of store writes or reads that failed")
            .register(meterRegistry);

        catchUps = Counter.builder("herald.jobs.catchup")
            .description("Number of overdue jobs fired during recovery")
            .register(meterRegistry);

        Gauge.builder("herald.jobs.armed", this, NotificationScheduler::armedCount)
            .description("Number of jobs with a pending timer")
            .register(meterRegistry);
    }

    /**
     * Schedule a notification.
     *
     * @param payload what to deliver
     * @param firstFireTime first (or only) occurrence
     * @param recurrence recurrence rule, null for a one-shot job
     * @return the new job id
     * @throws PastScheduleTimeException if a one-shot job is scheduled at or before now
     * @throws InvalidRecurrenceRuleException if the recurrence rule is malformed
     * @throws StoreFailureException if the job is scheduled but could not be persisted
     */
    public String submit(NotificationPayload payload, Instant firstFireTime, RecurrenceRule recurrence) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(firstFireTime, "firstFireTime");

        Instant now = clock.now();
        if (recurrence == null) {
            if (!firstFireTime.isAfter(now)) {
                throw new PastScheduleTimeException(firstFireTime, now);
            }
        } else {
            recurrenceCalculator.validate(recurrence, firstFireTime.isAfter(now) ? firstFireTime : now);
        }

        ScheduledJob job = ScheduledJob.builder()
            .id(generateJobId())
            .payload(payload)
            .firstFireTime(firstFireTime)
            .recurrence(recurrence)
            .nextFireTime(firstFireTime)
            .active(true)
            .status(JobStatus.SCHEDULED)
            .createdTime(now)
            .build();

        JobSlot slot = new JobSlot(job);
        tableLock.lock();
        try {
            jobs.put(job.getId(), slot);
        } finally {
            tableLock.unlock();
        }

        slot.stateLock.lock();
        try {
            StoreFailureException failure = tryPersist(job);
            // an overdue recurring job gets a zero delay: one catch-up, then its normal cadence
            arm(slot, Duration.between(now, firstFireTime));
            log.info("Submitted {} job {} \"{}\" first firing at {}",
                recurrence == null ? "one-shot" : recurrence.getKind(), job.getId(),
                payload.getTitle(), firstFireTime);
            if (failure != null) {
                throw failure;
            }
        } finally {
            slot.stateLock.unlock();
        }
        return job.getId();
    }

    /**
     * Cancel a job. An in-flight delivery completes but the job is not re-armed.
     *
     * @param jobId job identifier
     * @return false if the job is unknown
     */
    public boolean cancel(String jobId) {
        JobSlot slot = jobs.get(jobId);
        if (slot == null) {
            return false;
        }

        slot.stateLock.lock();
        try {
            disarm(slot);
            ScheduledJob job = slot.job;
            if (job.getStatus() == JobStatus.CANCELLED || job.getStatus().isTerminal()) {
                return true;
            }
            job.transitionTo(JobStatus.CANCELLED);
            persist(job);
            log.info("Cancelled job {} \"{}\"", jobId, job.getPayload().getTitle());
            return true;
        } finally {
            slot.stateLock.unlock();
        }
    }

    /**
     * Pause a job, keeping its recurrence and next occurrence for a later resume.
     *
     * @param jobId job identifier
     * @return false if the job is unknown
     */
    public boolean pause(String jobId) {
        JobSlot slot = jobs.get(jobId);
        if (slot == null) {
            return false;
        }

        slot.stateLock.lock();
        try {
            ScheduledJob job = slot.job;
            if (!job.isActive()) {
                return true;
            }
            disarm(slot);
            job.transitionTo(JobStatus.PAUSED);
            persist(job);
            log.info("Paused job {} (next firing was {})", jobId, job.getNextFireTime());
            return true;
        } finally {
            slot.stateLock.unlock();
        }
    }

    /**
     * Re-activate a paused or cancelled job. A recurring job whose next occurrence has
     * passed is moved to its next occurrence after now.
     *
     * @param jobId job identifier
     * @return false if the job is unknown
     * @throws CannotResumeCompletedJobException if the job has no occurrence left
     */
    public boolean resume(String jobId) {
        JobSlot slot = jobs.get(jobId);
        if (slot == null) {
            return false;
        }

        slot.stateLock.lock();
        try {
            ScheduledJob job = slot.job;
            if (job.isActive()) {
                return true;
            }
            if (job.getStatus().isTerminal() || job.getNextFireTime() == null) {
                throw new CannotResumeCompletedJobException(jobId, "job is " + job.getStatus());
            }

            Instant now = clock.now();
            Instant next = job.getNextFireTime();
            if (!next.isAfter(now)) {
                if (!job.isRecurring()) {
                    throw new CannotResumeCompletedJobException(jobId,
                        "one-shot occurrence at " + next + " has passed");
                }
                next = recurrenceCalculator.next(now, job.getRecurrence());
                if (job.getRecurrence().isPastEnd(next)) {
                    job.setNextFireTime(null);
                    job.transitionTo(JobStatus.EXPIRED);
                    persist(job);
                    throw new CannotResumeCompletedJobException(jobId,
                        "recurrence ended at " + job.getRecurrence().getEndTime());
                }
                job.setNextFireTime(next);
            }

            job.transitionTo(JobStatus.SCHEDULED);
            StoreFailureException failure = tryPersist(job);
            arm(slot, Duration.between(now, next));
            log.info("Resumed job {} next firing at {}", jobId, next);
            if (failure != null) {
                throw failure;
            }
            return true;
        } finally {
            slot.stateLock.unlock();
        }
    }

    /**
     * Snapshot of every job, oldest first
     */
    public List<ScheduledJob> list() {
        List<ScheduledJob> snapshot = new ArrayList<>();
        for (JobSlot slot : jobs.values()) {
            snapshot.add(slot.snapshot());
        }
        snapshot.sort(Comparator.comparing(ScheduledJob::getCreatedTime,
            Comparator.nullsFirst(Comparator.naturalOrder())));
        return snapshot;
    }

    /**
     * Snapshot of one job
     */
    public Optional<ScheduledJob> find(String jobId) {
        JobSlot slot = jobs.get(jobId);
        return slot == null ? Optional.empty() : Optional.of(slot.snapshot());
    }

    /**
     * Most recent delivery attempts, newest first
     *
     * @param limit maximum number of entries
     * @throws StoreFailureException if the history cannot be read
     */
    public List<HistoryEntry> history(int limit) {
        List<HistoryEntry> entries;
        try {
            entries = store.loadHistory(limit).collectList().block(storeTimeout);
        } catch (RuntimeException e) {
            storeFailures.increment();
            throw new StoreFailureException(null, "Failed to load history", Exceptions.unwrap(e));
        }
        if (entries == null) {
            return List.of();
        }
        List<HistoryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(HistoryEntry::getFiredAt,
            Comparator.nullsLast(Comparator.reverseOrder())));
        return sorted;
    }

    /**
     * Deliver a notification right away, bypassing the job table.
     * The attempt is recorded to history without a job id.
     *
     * @param payload what to deliver
     * @return delivery outcome
     * @throws StoreFailureException if the attempt was made but could not be recorded
     */
    public DispatchResult dispatchNow(NotificationPayload payload) {
        Objects.requireNonNull(payload, "payload");

        DispatchResult result = deliver(null, payload);
        record(historyEntry(null, payload, clock.now(), result));

        log.info("Immediate notification \"{}\" to {}: {}", payload.getTitle(), payload.getDestination(),
            result.isSuccess() ? "delivered" : result.getError());
        return result;
    }

    /**
     * Remove an inactive job from the table and the store.
     *
     * @param jobId job identifier
     * @return false if the job is unknown or still active
     * @throws StoreFailureException if the job was removed from memory but not from the store
     */
    public boolean prune(String jobId) {
        tableLock.lock();
        try {
            JobSlot slot = jobs.get(jobId);
            if (slot == null) {
                return false;
            }
            slot.stateLock.lock();
            try {
                if (slot.job.isActive()) {
                    return false;
                }
                disarm(slot);
                slot.removed = true;
            } finally {
                slot.stateLock.unlock();
            }
            jobs.remove(jobId);
        } finally {
            tableLock.unlock();
        }

        try {
            store.deleteJob(jobId).block(storeTimeout);
        } catch (RuntimeException e) {
            storeFailures.increment();
            throw new StoreFailureException(jobId, "Failed to delete job " + jobId, Exceptions.unwrap(e));
        }
        log.info("Pruned job {}", jobId);
        return true;
    }

    /**
     * Prune every inactive job
     *
     * @return number of jobs removed
     */
    public int pruneInactive() {
        int pruned = 0;
        for (ScheduledJob job : list()) {
            if (!job.isActive() && prune(job.getId())) {
                pruned++;
            }
        }
        return pruned;
    }

    /**
     * Load persisted jobs and bring them back to life. Overdue jobs fire once, synchronously;
     * the rest are armed for their next occurrence. Runs once; later calls are ignored.
     *
     * @throws StoreFailureException if the persisted jobs cannot be loaded
     */
    @PostConstruct
    public void recover() {
        if (!recovered.compareAndSet(false, true)) {
            log.warn("Recovery already ran, ignoring");
            return;
        }

        List<ScheduledJob> persisted;
        try {
            persisted = store.loadAll().collectList().block(storeTimeout);
        } catch (RuntimeException e) {
            storeFailures.increment();
            throw new StoreFailureException(null, "Failed to load persisted jobs", Exceptions.unwrap(e));
        }
        if (persisted == null) {
            persisted = List.of();
        }

        List<JobSlot> loaded = new ArrayList<>();
        tableLock.lock();
        try {
            for (ScheduledJob job : persisted) {
                if (job.getStatus() == null) {
                    job.transitionTo(job.isActive() ? JobStatus.SCHEDULED : JobStatus.PAUSED);
                }
                JobSlot slot = new JobSlot(job);
                if (jobs.putIfAbsent(job.getId(), slot) == null) {
                    loaded.add(slot);
                }
            }
        } finally {
            tableLock.unlock();
        }

        Instant now = clock.now();
        int armed = 0;
        int caughtUp = 0;
        for (JobSlot slot : loaded) {
            Instant next;
            long generation;
            slot.stateLock.lock();
            try {
                if (!slot.job.isActive() || slot.job.getNextFireTime() == null) {
                    continue;
                }
                next = slot.job.getNextFireTime();
                generation = slot.generation;
                if (next.isAfter(now)) {
                    arm(slot, Duration.between(now, next));
                    armed++;
                    continue;
                }
            } finally {
                slot.stateLock.unlock();
            }

            log.info("Job {} was due at {}, catching up", slot.job.getId(), next);
            catchUps.increment();
            caughtUp++;
            try {
                fire(slot, generation);
            } catch (RuntimeException e) {
                log.error("Catch-up of job {} failed, continuing recovery", slot.job.getId(), e);
            }
        }

        log.info("Recovered {} jobs: {} armed, {} caught up, {} idle",
            loaded.size(), armed, caughtUp, loaded.size() - armed - caughtUp);
    }

    /**
     * Disarm every timer. Persisted state is left as is, so the next recovery picks up where this left off.
     */
    @PreDestroy
    public void shutdown() {
        for (JobSlot slot : jobs.values()) {
            slot.stateLock.lock();
            try {
                disarm(slot);
            } finally {
                slot.stateLock.unlock();
            }
        }
        log.info("Notification scheduler stopped, {} jobs disarmed", jobs.size());
    }

    public int jobCount() {
        return jobs.size();
    }

    public long activeCount() {
        return jobs.values().stream().filter(slot -> slot.job.isActive()).count();
    }

    public long armedCount() {
        return jobs.values().stream().filter(JobSlot::isArmed).count();
    }

    /**
     * Firing protocol for one occurrence. Serialized per job by the firing lock.
     */
    void fire(JobSlot slot, long generation) {
        slot.firingLock.lock();
        try {
            NotificationPayload payload;
            slot.stateLock.lock();
            try {
                // cancelled, paused or re-armed after this timer was set
                if (slot.generation != generation || !slot.job.isActive()) {
                    log.debug("Skipping stale firing of job {}", slot.job.getId());
                    return;
                }
                slot.timer = null;
                payload = slot.job.getPayload();
            } finally {
                slot.stateLock.unlock();
            }

            DispatchResult result = deliver(slot.job.getId(), payload);

            slot.stateLock.lock();
            try {
                ScheduledJob job = slot.job;
                Instant now = clock.now();

                try {
                    record(historyEntry(job.getId(), payload, now, result));
                } catch (StoreFailureException e) {
                    log.error("History of job {} not recorded", job.getId(), e);
                }

                job.setLastFireTime(now);
                if (!job.isRecurring()) {
                    job.setNextFireTime(null);
                    job.transitionTo(JobStatus.COMPLETED);
                } else if (slot.generation != generation) {
                    log.info("Job {} was {} during delivery, not re-arming", job.getId(), job.getStatus());
                } else {
                    reschedule(slot, now);
                }

                if (slot.removed) {
                    log.info("Job {} was pruned during delivery, not persisting", job.getId());
                    return;
                }
                try {
                    persist(job);
                } catch (StoreFailureException e) {
                    log.error("Job {} state after firing not persisted", job.getId(), e);
                }
            } finally {
                slot.stateLock.unlock();
            }
        } finally {
            slot.firingLock.unlock();
        }
    }

    // caller holds the state lock
    private void reschedule(JobSlot slot, Instant now) {
        ScheduledJob job = slot.job;
        RecurrenceRule rule = job.getRecurrence();
        Instant candidate;
        try {
            candidate = recurrenceCalculator.next(now, rule);
        } catch (InvalidRecurrenceRuleException | DateTimeException | ArithmeticException e) {
            log.error("Job {} has an unusable recurrence rule, stopping it", job.getId(), e);
            job.setNextFireTime(null);
            job.transitionTo(JobStatus.EXPIRED);
            return;
        }

        if (rule.isPastEnd(candidate)) {
            job.setNextFireTime(null);
            job.transitionTo(JobStatus.EXPIRED);
            log.info("Job {} reached its end time {}", job.getId(), rule.getEndTime());
            return;
        }

        job.setNextFireTime(candidate);
        arm(slot, Duration.between(now, candidate));
        log.debug("Job {} re-armed for {}", job.getId(), candidate);
    }

    private DispatchResult deliver(String jobId, NotificationPayload payload) {
        try {
            String deliveryId = dispatcher.deliver(payload).block(dispatchTimeout);
            dispatchSucceeded.increment();
            log.info("Delivered \"{}\" (job {}) to {}", payload.getTitle(), jobId, payload.getDestination());
            return DispatchResult.delivered(deliveryId);
        } catch (RuntimeException e) {
            dispatchFailed.increment();
            Throwable cause = Exceptions.unwrap(e);
            String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("Delivery of \"{}\" (job {}) failed: {}", payload.getTitle(), jobId, error);
            return DispatchResult.failed(error);
        }
    }

    // caller holds the state lock
    private void arm(JobSlot slot, Duration delay) {
        disarm(slot);
        long generation = slot.generation;
        Duration wait = delay.isNegative() ? Duration.ZERO : delay;
        Disposable timer = clock.after(wait, () -> onTimer(slot, generation));
        // with virtual time the task may already have run and re-armed the job
        if (slot.generation == generation) {
            slot.timer = timer;
        }
    }

    // caller holds the state lock
    private void disarm(JobSlot slot) {
        Disposable timer = slot.timer;
        if (timer != null) {
            timer.dispose();
            slot.timer = null;
        }
        slot.generation++;
    }

    private void onTimer(JobSlot slot, long generation) {
        try {
            fire(slot, generation);
        } catch (RuntimeException e) {
            log.error("Firing protocol of job {} failed", slot.job.getId(), e);
        }
    }

    private void persist(ScheduledJob job) {
        try {
            store.upsertJob(job.copy()).block(storeTimeout);
        } catch (RuntimeException e) {
            storeFailures.increment();
            throw new StoreFailureException(job.getId(), "Failed to persist job " + job.getId(),
                Exceptions.unwrap(e));
        }
    }

    private StoreFailureException tryPersist(ScheduledJob job) {
        try {
            persist(job);
            return null;
        } catch (StoreFailureException e) {
            log.error("Job {} is scheduled in memory but not persisted", job.getId(), e);
            return e;
        }
    }

    private void record(HistoryEntry entry) {
        try {
            store.appendHistory(entry).block(storeTimeout);
        } catch (RuntimeException e) {
            storeFailures.increment();
            throw new StoreFailureException(entry.getJobId(), "Failed to record history entry " + entry.getId(),
                Exceptions.unwrap(e));
        }
    }

    private HistoryEntry historyEntry(String jobId, NotificationPayload payload, Instant firedAt,
                                      DispatchResult result) {
        return HistoryEntry.builder()
            .id(UUID.randomUUID().toString())
            .jobId(jobId)
            .firedAt(firedAt)
            .success(result.isSuccess())
            .errorDetail(result.getError())
            .destinationEcho(payload.getDestination())
            .deliveryId(result.getDeliveryId())
            .build();
    }

    private String generateJobId() {
        return "ntf-" + UUID.randomUUID();
    }

    /**
     * A job plus the scheduling state that never leaves this class
     */
    static final class JobSlot {
        final ScheduledJob job;
        final ReentrantLock stateLock = new ReentrantLock();
        final ReentrantLock firingLock = new ReentrantLock();
        volatile Disposable timer;
        long generation;
        // set by prune; the record must not be written again
        boolean removed;

        JobSlot(ScheduledJob job) {
            this.job = job;
        }

        boolean isArmed() {
            Disposable current = timer;
            return current != null && !current.isDisposed();
        }

        ScheduledJob snapshot() {
            stateLock.lock();
            try {
                return job.copy();
            } finally {
                stateLock.unlock();
            }
        }
    }
}
