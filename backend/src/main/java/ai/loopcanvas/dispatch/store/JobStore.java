package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;
import ai.loopcanvas.dispatch.model.dto.QueueStats;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable storage for generation jobs.
 * Every mutation goes through one of these primitives, each responsible for its own atomicity.
 */
public interface JobStore {

    /**
     * Inserts a new QUEUED job
     *
     * @param job the job to store, with id and timestamps already assigned
     * @return the job id
     * @throws JobStoreException on storage I/O failure
     */
    String enqueue(GenerationJob job);

    /**
     * Atomically takes the best QUEUED job (lowest priority, then oldest) and marks it CLAIMED.
     * Concurrent callers never receive the same job.
     *
     * @param workerId the claiming worker
     * @param workerType descriptive worker tag
     * @return the claimed job, empty when nothing is queued or the race was lost
     */
    Optional<GenerationJob> claim(String workerId, String workerType);

    /**
     * Best-effort progress update. Ignored for jobs that are not active or are held
     * by a different worker; never changes a terminal status.
     *
     * @param jobId the job
     * @param workerId the reporting worker, or null to skip the ownership check
     * @param progress percentage 0-100
     * @param message human readable progress message
     * @param status requested forward status, or null to keep the current one
     * @return true if the update was recorded
     */
    boolean updateProgress(String jobId, String workerId, int progress, String message, JobStatus status);

    /**
     * Marks the job COMPLETE with its output. Repeating the same payload is a no-op success.
     *
     * @return true if the job is (now) complete with this output
     */
    boolean complete(String jobId, String workerId, JobOutput output);

    /**
     * Reports a generation failure, consuming one attempt
     *
     * @return QUEUED or DEAD, empty if the report was ignored
     */
    Optional<JobStatus> fail(String jobId, String workerId, String error);

    /**
     * Returns active jobs claimed before the cutoff to QUEUED without consuming an attempt
     *
     * @return number of jobs requeued
     */
    int requeueStale(Instant cutoff);

    Optional<GenerationJob> get(String jobId);

    QueueStats stats();

    /**
     * Short backend name for logs, stats and health output
     */
    String backendName();

    /**
     * Exception thrown when the backing medium cannot be read or written
     */
    class JobStoreException extends RuntimeException {
        public JobStoreException(String message) {
            super(message);
        }

        public JobStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
