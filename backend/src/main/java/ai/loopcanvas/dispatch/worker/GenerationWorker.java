package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Pull-based generation worker: claim, generate, report.
 *
 * Claim, complete and fail calls are retried with backoff and then abandoned for this cycle;
 * an abandoned claim is recovered by the queue's stale-claim monitor. Progress reports are
 * best effort and never interrupt generation.
 */
@Slf4j
public class GenerationWorker {

    static final int MAX_ERROR_LENGTH = 500;

    /**
     * Pause between polls and retries
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final String workerId;
    private final String workerType;
    private final WorkerClient client;
    private final GenerationPipeline pipeline;
    private final CallRetryPolicy retryPolicy;
    private final Duration pollInterval;
    private final Duration maxIdle;
    private final Clock clock;
    private final Sleeper sleeper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final WorkerStats stats = new WorkerStats();

    public GenerationWorker(String workerId, String workerType, WorkerClient client, GenerationPipeline pipeline,
                            CallRetryPolicy retryPolicy, Duration pollInterval, Duration maxIdle) {
        this(workerId, workerType, client, pipeline, retryPolicy, pollInterval, maxIdle,
                Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    public GenerationWorker(String workerId, String workerType, WorkerClient client, GenerationPipeline pipeline,
                            CallRetryPolicy retryPolicy, Duration pollInterval, Duration maxIdle,
                            Clock clock, Sleeper sleeper) {
        this.workerId = workerId;
        this.workerType = workerType;
        this.client = client;
        this.pipeline = pipeline;
        this.retryPolicy = retryPolicy;
        this.pollInterval = pollInterval;
        this.maxIdle = maxIdle != null ? maxIdle : Duration.ZERO;
        this.clock = clock;
        this.sleeper = sleeper;
        log.info("GenerationWorker {} ({}) initialized against {}", workerId, workerType, client.describe());
    }

    /**
     * Claims and processes at most one job
     *
     * @return true if a job was claimed
     * @throws InterruptedException if the worker thread is interrupted
     */
    public boolean runOnce() throws InterruptedException {
        Optional<GenerationJob> claimed = callWithRetry("claim",
                () -> client.claim(workerId, workerType), Optional.empty());
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    /**
     * Polls until {@link #stop()} is called or no job was found for max idle (when non-zero)
     */
    public void runContinuous() throws InterruptedException {
        running.set(true);
        log.info("Worker {} polling every {} (max idle: {})", workerId, pollInterval,
                maxIdle.isZero() ? "unlimited" : maxIdle);
        Instant lastWork = clock.instant();
        try {
            while (running.get()) {
                boolean worked;
                try {
                    worked = runOnce();
                } catch (RuntimeException e) {
                    // a client bug must not end the loop; the next poll starts clean
                    log.error("Worker {} - poll cycle failed: {}", workerId, e.getMessage(), e);
                    worked = false;
                }
                if (worked) {
                    lastWork = clock.instant();
                    continue;
                }
                if (!maxIdle.isZero() && !Duration.between(lastWork, clock.instant()).minus(maxIdle).isNegative()) {
                    log.info("Worker {} idle for {}, stopping", workerId, maxIdle);
                    break;
                }
                sleeper.sleep(pollInterval);
            }
        } finally {
            running.set(false);
            log.info("Worker {} stopped: {}", workerId, stats.toMap());
        }
    }

    public void stop() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public WorkerStats getStats() {
        return stats;
    }

    public String getWorkerId() {
        return workerId;
    }

    private void process(GenerationJob job) throws InterruptedException {
        String jobId = job.getJobId();
        Instant start = clock.instant();
        log.info("Worker {} processing job {} (attempt {}/{})",
                workerId, jobId, job.getAttempt() + 1, job.getMaxAttempts());

        GenerationResult result;
        try {
            result = pipeline.generate(job, (progress, message, status) ->
                    reportProgress(jobId, progress, message, status));
        } catch (GenerationException e) {
            reportFailure(jobId, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Worker {} - unexpected error generating job {}", workerId, jobId, e);
            reportFailure(jobId, "Unexpected error: " + e.getMessage());
            return;
        }

        JobOutput output = result.toOutput();
        boolean accepted = callWithRetry("complete",
                () -> client.complete(jobId, workerId, output), false);
        Duration elapsed = Duration.between(start, clock.instant());
        if (accepted) {
            stats.recordCompleted(elapsed);
            log.info("Worker {} completed job {} in {}s: {}", workerId, jobId, elapsed.toSeconds(), result.getOutputRef());
        } else {
            log.warn("Worker {} - completion of job {} was not accepted", workerId, jobId);
        }
    }

    private void reportFailure(String jobId, String error) throws InterruptedException {
        String shortError = shorten(error);
        stats.recordFailed();
        Optional<JobStatus> outcome = callWithRetry("fail",
                () -> client.fail(jobId, workerId, shortError), Optional.empty());
        if (outcome.isPresent()) {
            log.warn("Worker {} - job {} failed ({}): {}", workerId, jobId, outcome.get().getValue(), shortError);
        } else {
            log.warn("Worker {} - failure report for job {} was not accepted: {}", workerId, jobId, shortError);
        }
    }

    /**
     * The one place progress errors are dropped
     */
    private void reportProgress(String jobId, int progress, String message, JobStatus status) {
        try {
            client.reportProgress(jobId, workerId, progress, message, status);
        } catch (RuntimeException e) {
            log.debug("Worker {} - progress update for job {} dropped: {}", workerId, jobId, e.getMessage());
        }
    }

    private <T> T callWithRetry(String operation, Supplier<T> call, T onGiveUp) throws InterruptedException {
        for (int failures = 1; ; failures++) {
            try {
                return call.get();
            } catch (WorkerClientException e) {
                if (!retryPolicy.shouldRetry(failures)) {
                    log.error("Worker {} - {} gave up after {} attempt(s): {}",
                            workerId, operation, failures, e.getMessage());
                    return onGiveUp;
                }
                Duration delay = retryPolicy.delayAfter(failures);
                log.warn("Worker {} - {} failed: {}. Retry {}/{} in {}ms",
                        workerId, operation, e.getMessage(), failures, retryPolicy.getMaxRetries(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    static String shorten(String error) {
        if (error == null || error.isBlank()) {
            return "unknown error";
        }
        String singleLine = error.strip().replaceAll("\\s+", " ");
        return singleLine.length() > MAX_ERROR_LENGTH ? singleLine.substring(0, MAX_ERROR_LENGTH) : singleLine;
    }
}
