package com.whereq.herald.controller;

import com.whereq.herald.dto.JobActionResponse;
import com.whereq.herald.dto.NotificationRequest;
import com.whereq.herald.dto.NotificationSubmitResponse;
import com.whereq.herald.dto.ShortcutRequest;
import com.whereq.herald.exception.CannotResumeCompletedJobException;
import com.whereq.herald.exception.InvalidRecurrenceRuleException;
import com.whereq.herald.exception.PastScheduleTimeException;
import com.whereq.herald.exception.StoreFailureException;
import com.whereq.herald.model.HistoryEntry;
import com.whereq.herald.model.ScheduledJob;
import com.whereq.herald.service.NotificationScheduler;
import com.whereq.herald.service.SchedulingShortcuts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Controller for scheduling, sending and managing notifications
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Tag(name = "Notifications", description = "Schedule and manage notifications")
public class NotificationController {

    private final NotificationScheduler scheduler;
    private final SchedulingShortcuts shortcuts;

    /**
     * Send a notification now, or schedule it when a schedule time is given
     *
     * @param request notification request
     * @return Mono with 200 (sent now) or 202 (scheduled)
     */
    @PostMapping
    @Operation(summary = "Send or schedule a notification")
    public Mono<ResponseEntity<NotificationSubmitResponse>> submit(@Valid @RequestBody NotificationRequest request) {
        if (request.getScheduleTime() == null) {
            log.info("Immediate notification \"{}\" to {}", request.getTitle(), request.getDestination());
            return blocking(() -> scheduler.dispatchNow(request.toPayload()))
                .map(result -> ResponseEntity.ok(NotificationSubmitResponse.builder()
                    .submittedAt(Instant.now())
                    .dispatch(result)
                    .build()))
                .onErrorResume(submissionErrors());
        }

        log.info("Scheduling notification \"{}\" at {} (recurrence: {})",
            request.getTitle(), request.getScheduleTime(), request.getRecurrence());
        return scheduled(() -> scheduler.submit(
            request.toPayload(), request.getScheduleTime(), request.getRecurrence()));
    }

    @PostMapping("/shortcuts/daily")
    @Operation(summary = "Schedule a notification every day at a given time")
    public Mono<ResponseEntity<NotificationSubmitResponse>> daily(@Valid @RequestBody ShortcutRequest request) {
        return scheduled(() -> shortcuts.dailyAt(request.toPayload(), request.getTime()));
    }

    @PostMapping("/shortcuts/weekly")
    @Operation(summary = "Schedule a notification every week on a given day and time")
    public Mono<ResponseEntity<NotificationSubmitResponse>> weekly(@Valid @RequestBody ShortcutRequest request) {
        return scheduled(() -> {
            if (request.getDayOfWeek() == null) {
                throw new IllegalArgumentException("'dayOfWeek' is required for weekly notifications");
            }
            return shortcuts.weeklyOn(request.toPayload(), request.getDayOfWeek(), request.getTime());
        });
    }

    @PostMapping("/shortcuts/monthly")
    @Operation(summary = "Schedule a notification every month on a given day and time")
    public Mono<ResponseEntity<NotificationSubmitResponse>> monthly(@Valid @RequestBody ShortcutRequest request) {
        return scheduled(() -> {
            if (request.getDayOfMonth() == null) {
                throw new IllegalArgumentException("'dayOfMonth' is required for monthly notifications");
            }
            return shortcuts.monthlyOn(request.toPayload(), request.getDayOfMonth(), request.getTime());
        });
    }

    @GetMapping
    @Operation(summary = "List all notifications")
    public Mono<List<ScheduledJob>> list() {
        return Mono.fromCallable(scheduler::list);
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get one notification")
    public Mono<ResponseEntity<ScheduledJob>> get(@PathVariable String jobId) {
        return Mono.fromCallable(() -> scheduler.find(jobId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @GetMapping("/history")
    @Operation(summary = "Most recent delivery attempts, newest first")
    public Mono<ResponseEntity<List<HistoryEntry>>> history(@RequestParam(defaultValue = "50") int limit) {
        return blocking(() -> scheduler.history(limit))
            .map(ResponseEntity::ok)
            .onErrorResume(StoreFailureException.class, e -> {
                log.error("History unavailable: {}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<List<HistoryEntry>>build());
            });
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel a notification")
    public Mono<ResponseEntity<JobActionResponse>> cancel(@PathVariable String jobId) {
        log.info("Cancellation request for {}", jobId);
        return action(jobId, () -> scheduler.cancel(jobId), "Notification cancelled");
    }

    @PostMapping("/{jobId}/pause")
    @Operation(summary = "Pause a notification")
    public Mono<ResponseEntity<JobActionResponse>> pause(@PathVariable String jobId) {
        log.info("Pause request for {}", jobId);
        return action(jobId, () -> scheduler.pause(jobId), "Notification paused");
    }

    @PostMapping("/{jobId}/resume")
    @Operation(summary = "Resume a paused or cancelled notification")
    public Mono<ResponseEntity<JobActionResponse>> resume(@PathVariable String jobId) {
        log.info("Resume request for {}", jobId);
        return action(jobId, () -> scheduler.resume(jobId), "Notification resumed");
    }

    @DeleteMapping("/{jobId}/record")
    @Operation(summary = "Delete an inactive notification")
    public Mono<ResponseEntity<Map<String, Object>>> prune(@PathVariable String jobId) {
        return blocking(() -> {
            ScheduledJob job = scheduler.find(jobId).orElse(null);
            if (job == null) {
                return ResponseEntity.notFound().<Map<String, Object>>build();
            }
            if (job.isActive() || !scheduler.prune(jobId)) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.<String, Object>of("jobId", jobId, "error", "Notification is still active"));
            }
            return ResponseEntity.ok(Map.<String, Object>of("jobId", jobId, "pruned", true));
        })
        .onErrorResume(StoreFailureException.class, e -> Mono.just(ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.<String, Object>of("jobId", jobId, "error", e.getMessage()))));
    }

    @DeleteMapping("/inactive")
    @Operation(summary = "Delete every inactive notification")
    public Mono<ResponseEntity<Map<String, Object>>> pruneInactive() {
        return blocking(scheduler::pruneInactive)
            .map(count -> ResponseEntity.ok(Map.<String, Object>of("pruned", count)))
            .onErrorResume(StoreFailureException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.<String, Object>of("error", e.getMessage()))));
    }

    private Mono<ResponseEntity<NotificationSubmitResponse>> scheduled(Callable<String> submission) {
        return blocking(submission)
            .map(jobId -> {
                ScheduledJob job = scheduler.find(jobId).orElse(null);
                return ResponseEntity
                    .status(HttpStatus.ACCEPTED)
                    .location(URI.create("/api/v1/notifications/" + jobId))
                    .body(NotificationSubmitResponse.builder()
                        .jobId(jobId)
                        .status(job != null ? job.getStatus() : null)
                        .nextFireTime(job != null ? job.getNextFireTime() : null)
                        .submittedAt(Instant.now())
                        .build());
            })
            .onErrorResume(submissionErrors());
    }

    private Function<Throwable, Mono<ResponseEntity<NotificationSubmitResponse>>> submissionErrors() {
        return e -> {
            if (e instanceof PastScheduleTimeException
                || e instanceof InvalidRecurrenceRuleException
                || e instanceof IllegalArgumentException) {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(NotificationSubmitResponse.error(e.getMessage())));
            }
            if (e instanceof StoreFailureException storeFailure) {
                log.error("Notification accepted but not persisted: {}", e.getMessage());
                NotificationSubmitResponse body = NotificationSubmitResponse.error(e.getMessage());
                body.setJobId(storeFailure.getJobId());
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body));
            }
            log.error("Unexpected error during notification submission", e);
            return Mono.just(ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(NotificationSubmitResponse.error("Internal server error: " + e.getMessage())));
        };
    }

    private Mono<ResponseEntity<JobActionResponse>> action(String jobId, Callable<Boolean> operation, String message) {
        return blocking(operation)
            .map(known -> {
                if (!known) {
                    return ResponseEntity.notFound().<JobActionResponse>build();
                }
                ScheduledJob job = scheduler.find(jobId).orElse(null);
                return ResponseEntity.ok(JobActionResponse.builder()
                    .jobId(jobId)
                    .status(job != null ? job.getStatus() : null)
                    .nextFireTime(job != null ? job.getNextFireTime() : null)
                    .actedAt(Instant.now())
                    .message(message)
                    .build());
            })
            .onErrorResume(CannotResumeCompletedJobException.class, e -> {
                log.error("Invalid state for resume: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(JobActionResponse.builder().jobId(jobId).message(e.getMessage()).build()));
            })
            .onErrorResume(StoreFailureException.class, e -> {
                log.error("Action on {} applied but not persisted: {}", jobId, e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(JobActionResponse.builder().jobId(jobId).message(e.getMessage()).build()));
            });
    }

    // scheduler calls wait on the store and dispatcher
    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
