package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;

import java.util.Optional;

/**
 * Calls a worker makes against the queue, either in-process or over HTTP.
 * Every method may throw {@link WorkerClientException} on transport or storage failure.
 */
public interface WorkerClient {

    /**
     * @return the claimed job, empty when nothing is queued
     */
    Optional<GenerationJob> claim(String workerId, String workerType);

    /**
     * @return false when the queue ignored the update
     */
    boolean reportProgress(String jobId, String workerId, int progress, String message, JobStatus status);

    boolean complete(String jobId, String workerId, JobOutput output);

    /**
     * @return QUEUED or DEAD, empty if the report was ignored
     */
    Optional<JobStatus> fail(String jobId, String workerId, String error);

    /**
     * Short name for logs
     */
    String describe();
}
