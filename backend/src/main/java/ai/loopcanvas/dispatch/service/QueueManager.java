package ai.loopcanvas.dispatch.service;

import ai.loopcanvas.dispatch.config.QueueProperties;
import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;
import ai.loopcanvas.dispatch.model.dto.QueueStats;
import ai.loopcanvas.dispatch.store.JobStore;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of the queue for the API server and in-process workers.
 * Owns the single {@link JobStore} of this process and the stale-claim monitor running against it.
 */
@Slf4j
@Service
public class QueueManager {

    private final JobStore jobStore;
    private final StaleClaimMonitor staleClaimMonitor;
    private final QueueMetricsService metricsService;
    private final WorkerRegistryService workerRegistry;
    private final QueueProperties queueProperties;
    private final Clock clock;

    public QueueManager(JobStore jobStore,
                        StaleClaimMonitor staleClaimMonitor,
                        QueueMetricsService metricsService,
                        WorkerRegistryService workerRegistry,
                        QueueProperties queueProperties,
                        Clock clock) {
        this.jobStore = jobStore;
        this.staleClaimMonitor = staleClaimMonitor;
        this.metricsService = metricsService;
        this.workerRegistry = workerRegistry;
        this.queueProperties = queueProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        QueueProperties.Monitor monitor = queueProperties.getMonitor();
        if (monitor.isEnabled()) {
            startMonitor(monitor.getInterval());
        } else {
            log.info("Stale-claim monitor disabled");
        }
    }

    @PreDestroy
    public void shutdown() {
        stopMonitor();
    }

    /**
     * Submits a new full-quality generation job
     *
     * @param inputRef opaque input reference, stored as given
     * @param priority lower is served first; null for the configured default
     * @param maxAttempts attempts before the job is dead; null for the configured default
     * @return the stored QUEUED job
     * @throws IllegalArgumentException if inputRef is missing or maxAttempts is below 1
     * @throws JobStore.JobStoreException on storage failure
     */
    public GenerationJob submit(Map<String, Object> inputRef, Integer priority, Integer maxAttempts) {
        if (inputRef == null) {
            throw new IllegalArgumentException("input_ref is required");
        }
        int attempts = maxAttempts != null ? maxAttempts : queueProperties.getDefaultMaxAttempts();
        if (attempts < 1) {
            throw new IllegalArgumentException("max_attempts must be at least 1");
        }

        Instant now = clock.instant();
        GenerationJob job = GenerationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .status(JobStatus.QUEUED)
                .createdAt(now)
                .updatedAt(now)
                .inputRef(new LinkedHashMap<>(inputRef))
                .generationMode(GenerationJob.MODE_FULL)
                .priority(priority != null ? priority : queueProperties.getDefaultPriority())
                .maxAttempts(attempts)
                .message("Queued")
                .build();

        jobStore.enqueue(job);
        metricsService.recordSubmitted();
        log.info("Submitted job {} (priority {}, max attempts {})", job.getJobId(), job.getPriority(), attempts);
        return job;
    }

    public Optional<GenerationJob> getStatus(String jobId) {
        return jobStore.get(jobId);
    }

    public QueueStats getStats() {
        return jobStore.stats();
    }

    public void startMonitor(Duration interval) {
        staleClaimMonitor.start(interval);
    }

    public void stopMonitor() {
        staleClaimMonitor.stop();
    }

    public boolean isMonitorRunning() {
        return staleClaimMonitor.isRunning();
    }

    public String getBackendName() {
        return jobStore.backendName();
    }

    // Worker-side operations

    public Optional<GenerationJob> claim(String workerId, String workerType) {
        Optional<GenerationJob> claimed = jobStore.claim(workerId, workerType);
        claimed.ifPresent(job -> metricsService.recordClaimed());
        workerRegistry.recordClaim(workerId, workerType, claimed.map(GenerationJob::getJobId).orElse(null));
        return claimed;
    }

    public boolean reportProgress(String jobId, String workerId, int progress, String message, JobStatus status) {
        return jobStore.updateProgress(jobId, workerId, progress, message, status);
    }

    public boolean complete(String jobId, String workerId, JobOutput output) {
        boolean accepted = jobStore.complete(jobId, workerId, output);
        if (accepted) {
            metricsService.recordCompleted();
            workerRegistry.recordCompletion(workerId, jobId);
        }
        return accepted;
    }

    public Optional<JobStatus> fail(String jobId, String workerId, String error) {
        Optional<JobStatus> outcome = jobStore.fail(jobId, workerId, error);
        outcome.ifPresent(status -> {
            metricsService.recordFailed(status);
            workerRegistry.recordFailure(workerId, jobId);
        });
        return outcome;
    }
}
