package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;
import ai.loopcanvas.dispatch.service.QueueManager;

import java.util.Optional;

/**
 * Worker client for a worker running in the same process as the queue.
 * Any queue-side exception becomes a {@link WorkerClientException} so the worker retries it.
 */
public class LocalWorkerClient implements WorkerClient {

    private final QueueManager queueManager;

    public LocalWorkerClient(QueueManager queueManager) {
        this.queueManager = queueManager;
    }

    @Override
    public Optional<GenerationJob> claim(String workerId, String workerType) {
        try {
            return queueManager.claim(workerId, workerType);
        } catch (RuntimeException e) {
            throw new WorkerClientException("Claim failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean reportProgress(String jobId, String workerId, int progress, String message, JobStatus status) {
        try {
            return queueManager.reportProgress(jobId, workerId, progress, message, status);
        } catch (RuntimeException e) {
            throw new WorkerClientException("Progress update failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean complete(String jobId, String workerId, JobOutput output) {
        try {
            return queueManager.complete(jobId, workerId, output);
        } catch (RuntimeException e) {
            throw new WorkerClientException("Completion failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<JobStatus> fail(String jobId, String workerId, String error) {
        try {
            return queueManager.fail(jobId, workerId, error);
        } catch (RuntimeException e) {
            throw new WorkerClientException("Failure report failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "local:" + queueManager.getBackendName();
    }
}
