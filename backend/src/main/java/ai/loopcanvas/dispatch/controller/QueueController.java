package ai.loopcanvas.dispatch.controller;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.AckResponse;
import ai.loopcanvas.dispatch.model.dto.ClaimRequest;
import ai.loopcanvas.dispatch.model.dto.ClaimResponse;
import ai.loopcanvas.dispatch.model.dto.CompleteRequest;
import ai.loopcanvas.dispatch.model.dto.FailRequest;
import ai.loopcanvas.dispatch.model.dto.FailResponse;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.ProgressRequest;
import ai.loopcanvas.dispatch.model.dto.QueueStats;
import ai.loopcanvas.dispatch.service.QueueManager;
import ai.loopcanvas.dispatch.store.JobStore;

import io.micrometer.core.annotation.Timed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Worker RPCs (claim, progress, complete, fail) and queue statistics.
 * A storage failure answers 503 so workers retry the call.
 */
@Slf4j
@RestController
@RequestMapping("/api/v2/queue")
public class QueueController {

    private final QueueManager queueManager;

    public QueueController(QueueManager queueManager) {
        this.queueManager = queueManager;
    }

    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v2/queue/claim", "operation", "claim"})
    @PostMapping("/claim")
    public ResponseEntity<ClaimResponse> claim(@Valid @RequestBody ClaimRequest request) {
        try {
            Optional<GenerationJob> job = queueManager.claim(request.getWorkerId(), request.getWorkerType());
            return ResponseEntity.ok(job.map(ClaimResponse::new).orElseGet(ClaimResponse::empty));
        } catch (JobStore.JobStoreException e) {
            log.error("Claim by {} failed: {}", request.getWorkerId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @PostMapping("/progress")
    public ResponseEntity<AckResponse> progress(@Valid @RequestBody ProgressRequest request) {
        try {
            boolean ok = queueManager.reportProgress(request.getJobId(), request.getWorkerId(),
                    request.getProgress(), request.getMessage(), request.getStatus());
            return ResponseEntity.ok(AckResponse.of(ok));
        } catch (JobStore.JobStoreException e) {
            log.warn("Progress update for job {} failed: {}", request.getJobId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v2/queue/complete", "operation", "complete"})
    @PostMapping("/complete")
    public ResponseEntity<AckResponse> complete(@Valid @RequestBody CompleteRequest request) {
        try {
            boolean ok = queueManager.complete(request.getJobId(), request.getWorkerId(), request.toOutput());
            return ResponseEntity.ok(AckResponse.of(ok));
        } catch (JobStore.JobStoreException e) {
            log.error("Completion of job {} failed: {}", request.getJobId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @PostMapping("/fail")
    public ResponseEntity<FailResponse> fail(@Valid @RequestBody FailRequest request) {
        try {
            String error = request.getError() != null ? request.getError() : "unknown error";
            Optional<JobStatus> outcome = queueManager.fail(request.getJobId(), request.getWorkerId(), error);
            return ResponseEntity.ok(new FailResponse(outcome.isPresent(), outcome.orElse(null)));
        } catch (JobStore.JobStoreException e) {
            log.error("Failure report for job {} failed: {}", request.getJobId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * Job counts by status (zero-filled), total and score averages of completed jobs
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        try {
            QueueStats stats = queueManager.getStats();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("backend", stats.getBackend());
            body.putAll(stats.asValueMap());
            body.put("avg_quality_score", stats.getAverageQualityScore());
            body.put("avg_loop_score", stats.getAverageLoopScore());
            body.put("monitor_running", queueManager.isMonitorRunning());
            return ResponseEntity.ok(body);
        } catch (JobStore.JobStoreException e) {
            log.error("Failed to read queue statistics: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
