package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;

/**
 * Receives pipeline milestones. Implementations must not throw.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param status forward status to request, or null to keep the current one
     */
    void onProgress(int progress, String message, JobStatus status);
}
