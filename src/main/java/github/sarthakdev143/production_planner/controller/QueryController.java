package github.sarthakdev143.production_planner.controller;

import github.sarthakdev143.production_planner.dto.JobPlanStatusResponse;
import github.sarthakdev143.production_planner.dto.QuerySubmissionRequest;
import github.sarthakdev143.production_planner.dto.QuerySubmissionResponse;
import github.sarthakdev143.production_planner.model.ProgressMessage;
import github.sarthakdev143.production_planner.model.QuerySnapshot;
import github.sarthakdev143.production_planner.model.QueryStatus;
import github.sarthakdev143.production_planner.model.QueryRequest;
import github.sarthakdev143.production_planner.service.QueryAnalysisService;
import github.sarthakdev143.production_planner.service.impl.QueryRequestValidator;
import github.sarthakdev143.production_planner.service.progress.ProgressSubscription;
import github.sarthakdev143.production_planner.service.scheduling.JobScheduler;
import github.sarthakdev143.production_planner.service.scheduling.JobStateTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BiPredicate;

@RestController
@RequestMapping("/api/queries")
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);
    private static final long STREAM_TIMEOUT_MILLIS = Duration.ofMinutes(30).toMillis();
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final QueryAnalysisService queryAnalysisService;
    private final QueryRequestValidator queryRequestValidator;
    private final TaskExecutor progressStreamExecutor;

    public QueryController(
            QueryAnalysisService queryAnalysisService,
            QueryRequestValidator queryRequestValidator,
            @Qualifier("progressStreamExecutor") TaskExecutor progressStreamExecutor) {
        this.queryAnalysisService = queryAnalysisService;
        this.queryRequestValidator = queryRequestValidator;
        this.progressStreamExecutor = progressStreamExecutor;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submit(@RequestBody QuerySubmissionRequest submission) {
        try {
            QueryRequest request = queryRequestValidator.normalizeAndValidate(submission);
            String queryId = queryAnalysisService.submit(request);
            QueryStatus status = queryAnalysisService.getSnapshot(queryId)
                    .map(QuerySnapshot::status)
                    .orElse(QueryStatus.PENDING);
            return ResponseEntity.accepted()
                    .body(new QuerySubmissionResponse(
                            queryId,
                            status,
                            "Query accepted. Stream /api/queries/" + queryId + "/events for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Query submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to accept query. Please try again.");
        }
    }

    @GetMapping("/{queryId}")
    public ResponseEntity<?> getSnapshot(@PathVariable String queryId) {
        return queryAnalysisService.getSnapshot(queryId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> queryNotFound(queryId));
    }

    /**
     * Streams the query's progress messages as server-sent events, replaying history first. The
     * {@code after} parameter or a {@code Last-Event-ID} header resumes after that sequence.
     */
    @GetMapping(value = "/{queryId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(
            @PathVariable String queryId,
            @RequestParam(value = "after", required = false) Long after,
            @RequestHeader(value = "Last-Event-ID", required = false) Long lastEventId) {
        if ((after != null && after < 0) || (lastEventId != null && lastEventId < 0)) {
            return ResponseEntity.badRequest().build();
        }
        long afterSequence = Math.max(after == null ? 0L : after, lastEventId == null ? 0L : lastEventId);

        Optional<ProgressSubscription> subscription = queryAnalysisService.subscribe(queryId, afterSequence);
        if (subscription.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MILLIS);
        try {
            progressStreamExecutor.execute(() -> pump(subscription.get(), emitter));
        } catch (TaskRejectedException e) {
            logger.warn("Rejected progress stream for query {}; too many open streams", queryId);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(emitter);
    }

    @PostMapping("/{queryId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String queryId) {
        return switch (queryAnalysisService.cancel(queryId)) {
            case CANCELLED -> getSnapshot(queryId);
            case ALREADY_FINISHED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body("Query " + queryId + " has already finished.");
            case NOT_FOUND -> queryNotFound(queryId);
        };
    }

    @GetMapping("/{queryId}/manifest")
    public ResponseEntity<?> getManifest(@PathVariable String queryId) {
        return queryAnalysisService.getManifest(queryId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body("Manifest not found for query id: " + queryId));
    }

    @GetMapping("/{queryId}/jobs")
    public ResponseEntity<?> getJobs(@PathVariable String queryId) {
        return queryAnalysisService.getScheduler(queryId)
                .<ResponseEntity<?>>map(scheduler -> ResponseEntity.ok(jobStatus(queryId, scheduler)))
                .orElseGet(() -> jobPlanNotFound(queryId));
    }

    /**
     * Hands out every job that is ready now. Each job is returned to exactly one caller.
     */
    @PostMapping("/{queryId}/jobs/claim")
    public ResponseEntity<?> claimJobs(@PathVariable String queryId) {
        return queryAnalysisService.getScheduler(queryId)
                .<ResponseEntity<?>>map(scheduler -> ResponseEntity.ok(scheduler.drainReady()))
                .orElseGet(() -> jobPlanNotFound(queryId));
    }

    @PostMapping("/{queryId}/jobs/{jobId}/succeeded")
    public ResponseEntity<?> markJobSucceeded(@PathVariable String queryId, @PathVariable String jobId) {
        return reportJobOutcome(queryId, jobId, JobScheduler::markSucceeded);
    }

    @PostMapping("/{queryId}/jobs/{jobId}/failed")
    public ResponseEntity<?> markJobFailed(@PathVariable String queryId, @PathVariable String jobId) {
        return reportJobOutcome(queryId, jobId, JobScheduler::markFailed);
    }

    private ResponseEntity<?> reportJobOutcome(
            String queryId,
            String jobId,
            BiPredicate<JobScheduler, String> transition) {
        Optional<JobScheduler> scheduler = queryAnalysisService.getScheduler(queryId);
        if (scheduler.isEmpty()) {
            return jobPlanNotFound(queryId);
        }
        if (!scheduler.get().graph().contains(jobId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body("Job not found for id: " + jobId);
        }

        try {
            transition.test(scheduler.get(), jobId);
            return ResponseEntity.ok(jobStatus(queryId, scheduler.get()));
        } catch (JobStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        }
    }

    private void pump(ProgressSubscription subscription, SseEmitter emitter) {
        String queryId = subscription.queryId();
        try {
            while (true) {
                Optional<ProgressMessage> next = subscription.poll(HEARTBEAT_INTERVAL);
                if (next.isPresent()) {
                    ProgressMessage message = next.get();
                    emitter.send(SseEmitter.event()
                            .id(Long.toString(message.sequence()))
                            .name(message.type().toApiValue())
                            .data(message, MediaType.APPLICATION_JSON));
                } else if (subscription.isExhausted()) {
                    emitter.complete();
                    return;
                } else {
                    emitter.send(SseEmitter.event().comment("heartbeat"));
                }
            }
        } catch (IOException e) {
            logger.debug("Progress stream for query {} closed by client at sequence={}", queryId, subscription.cursor());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } catch (RuntimeException e) {
            logger.error("Progress stream for query {} failed", queryId, e);
            emitter.completeWithError(e);
        }
    }

    private JobPlanStatusResponse jobStatus(String queryId, JobScheduler scheduler) {
        return new JobPlanStatusResponse(queryId, scheduler.status(), scheduler.snapshot());
    }

    private ResponseEntity<?> queryNotFound(String queryId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Query not found for id: " + queryId);
    }

    private ResponseEntity<?> jobPlanNotFound(String queryId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job plan not found for query id: " + queryId);
    }
}
