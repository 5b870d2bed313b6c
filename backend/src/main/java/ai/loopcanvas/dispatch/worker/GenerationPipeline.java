package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.dto.GenerationJob;

/**
 * The long-running generation step. Opaque to the queue.
 */
public interface GenerationPipeline {

    /**
     * Runs generation for one claimed job
     *
     * @param job the claimed job, its input reference is the pipeline's to interpret
     * @param listener receives milestone progress
     * @return output location and scores
     * @throws GenerationException when this attempt failed
     * @throws InterruptedException when the worker is stopped mid-run
     */
    GenerationResult generate(GenerationJob job, ProgressListener listener)
            throws GenerationException, InterruptedException;
}
