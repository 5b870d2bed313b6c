package ai.loopcanvas.dispatch.controller;

import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.SubmitJobRequest;
import ai.loopcanvas.dispatch.service.QueueManager;
import ai.loopcanvas.dispatch.store.JobStore;

import io.micrometer.core.annotation.Timed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

/**
 * Submission API: create generation jobs and look them up
 */
@Slf4j
@RestController
@RequestMapping("/api/v2/jobs")
public class JobController {

    private final QueueManager queueManager;

    public JobController(QueueManager queueManager) {
        this.queueManager = queueManager;
    }

    /**
     * Queues a new full-quality generation job
     *
     * @param request input reference plus optional priority and max attempts
     * @return the stored job
     */
    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v2/jobs", "operation", "submit_job"})
    @PostMapping
    public ResponseEntity<GenerationJob> submitJob(@Valid @RequestBody SubmitJobRequest request) {
        try {
            GenerationJob job = queueManager.submit(request.getInputRef(), request.getPriority(), request.getMaxAttempts());
            return ResponseEntity.status(HttpStatus.CREATED).body(job);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected job submission: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (JobStore.JobStoreException e) {
            log.error("Failed to submit job: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<GenerationJob> getJob(@PathVariable String jobId) {
        try {
            return queueManager.getStatus(jobId)
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (JobStore.JobStoreException e) {
            log.error("Failed to read job {}: {}", jobId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
